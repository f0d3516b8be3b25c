package com.spacebooking.scheduling.domain.repository;

import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface SlotRepository extends JpaRepository<Slot, Long> {

    List<Slot> findByResourceIdAndSlotDateOrderByStartMinuteAsc(String resourceId, LocalDate slotDate);

    List<Slot> findByResourceIdAndSlotDateBetweenOrderBySlotDateAscStartMinuteAsc(
            String resourceId, LocalDate from, LocalDate to);

    List<Slot> findByResourceIdAndSlotDateAndStatusInOrderByStartMinuteAsc(
            String resourceId, LocalDate slotDate, Collection<SlotStatus> statuses);

    List<Slot> findByResourceIdAndSlotDateAndBookingRefOrderByStartMinuteAsc(
            String resourceId, LocalDate slotDate, String bookingRef);

    /**
     * Deletes a free slot only if nobody touched it since it was read.
     *
     * @return 1 when deleted, 0 when the slot changed or vanished
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           DELETE FROM Slot s
           WHERE s.id = :id
             AND s.version = :version
             AND s.status = :status
             AND s.bookingRef IS NULL
           """)
    int deleteIfUnchanged(@Param("id") Long id,
                          @Param("version") Long version,
                          @Param("status") SlotStatus status);

    /**
     * Moves the end of a free slot, guarded by its version, and bumps the version.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Slot s
           SET s.endMinute = :endMinute,
               s.version = s.version + 1,
               s.updatedAt = :updatedAt
           WHERE s.id = :id
             AND s.version = :version
             AND s.status = :status
             AND s.bookingRef IS NULL
           """)
    int resizeIfUnchanged(@Param("id") Long id,
                          @Param("version") Long version,
                          @Param("status") SlotStatus status,
                          @Param("endMinute") int endMinute,
                          @Param("updatedAt") LocalDateTime updatedAt);
}
