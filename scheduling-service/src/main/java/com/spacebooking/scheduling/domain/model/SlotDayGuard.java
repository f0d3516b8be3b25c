package com.spacebooking.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * One row per (resource, day). Row-locked with {@code SELECT ... FOR UPDATE} by the pessimistic
 * commit strategy so that writers of the same day queue up in the database.
 */
@Entity
@Table(name = "slot_day_guards", uniqueConstraints = {
        @UniqueConstraint(name = "uk_slot_day_guards_resource_date", columnNames = {"resource_id", "guard_date"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotDayGuard {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    @Column(name = "guard_date", nullable = false)
    private LocalDate guardDate;
}
