package com.spacebooking.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A bookable unit of time on one resource and one day.
 * Status changes go through {@code SlotStore.transition}; the version column detects concurrent writers.
 */
@Entity
@Table(name = "slots", indexes = {
        @Index(name = "idx_slots_resource_date", columnList = "resource_id,slot_date"),
        @Index(name = "idx_slots_booking_ref", columnList = "booking_ref")
})
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Slot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_minute", nullable = false)
    private Integer startMinute;

    @Column(name = "end_minute", nullable = false)
    private Integer endMinute;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SlotStatus status;

    @Column(name = "booking_ref", length = 64)
    private String bookingRef;

    @Column(name = "blocked_reason")
    private String blockedReason;

    @Column(name = "blocked_by", length = 64)
    private String blockedBy;

    /** Id of the slot this piece was cut from; null for slots that were never split. */
    @Column(name = "split_from")
    private Long splitFrom;

    @Convert(converter = RecurringPatternConverter.class)
    @Column(name = "recurring_pattern", columnDefinition = "TEXT")
    private RecurringPattern recurring;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Shared by every piece cut from the same original slot.
     */
    public Long lineageId() {
        return splitFrom != null ? splitFrom : id;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = SlotStatus.AVAILABLE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
