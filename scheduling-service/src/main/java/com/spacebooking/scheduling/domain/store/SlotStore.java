package com.spacebooking.scheduling.domain.store;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotTransition;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistence contract for slots.
 * <p>
 * {@link #transition} is the only way to change a slot's status. Writes that depend on a previously read
 * slot are version-checked and fail with {@link com.spacebooking.scheduling.exception.StaleSlotException}
 * (or return {@code false}) when the slot changed in between.
 * <p>
 * Implementations:
 * - JpaSlotStore: PostgreSQL through Spring Data JPA
 * - InMemorySlotStore: process-local maps, single node only
 */
public interface SlotStore {

    /**
     * All slots of a resource on one day, ordered by start minute.
     */
    List<Slot> get(String resourceId, LocalDate date);

    /**
     * All slots of a resource in {@code [from, to]}, ordered by day and start minute.
     */
    List<Slot> getRange(String resourceId, LocalDate from, LocalDate to);

    /**
     * Inserts a slot without id, or overwrites an existing one whose version still matches.
     * Overwriting never changes the status; that takes a {@link #transition}.
     */
    Slot upsert(Slot slot);

    Slot transition(Slot slot, SlotTransition transition);

    /**
     * BUSY, BLOCKED and MAINTENANCE slots overlapping {@code interval}.
     */
    List<Slot> findConflicting(String resourceId, LocalDate date, TimeInterval interval);

    List<Slot> findAvailable(String resourceId, LocalDate date);

    List<Slot> findByBookingRef(String resourceId, LocalDate date, String bookingRef);

    /**
     * Deletes an AVAILABLE slot without booking reference if its version is unchanged.
     */
    boolean removeIfUnchanged(Slot slot);

    /**
     * Sets a new end minute on an AVAILABLE slot without booking reference if its version is unchanged.
     */
    boolean resizeIfUnchanged(Slot slot, int newEndMinute);

    /**
     * Cuts an AVAILABLE slot without booking reference in two at {@code atMinute}. The slot keeps
     * {@code [start, atMinute)}; a new AVAILABLE slot of the same lineage takes {@code [atMinute, end)}.
     *
     * @return both pieces as stored, in start order
     * @throws com.spacebooking.scheduling.exception.StaleSlotException if the slot changed since it was read
     */
    List<Slot> split(Slot slot, int atMinute);
}
