package com.spacebooking.scheduling.domain.store;

import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.model.SlotTransition;
import com.spacebooking.scheduling.domain.repository.SlotRepository;
import com.spacebooking.scheduling.exception.StaleSlotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Slot store backed by PostgreSQL. Joins the caller's transaction when one is active.
 * Optimistic versioning (@Version on {@link Slot}) detects writers that raced past the commit lock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.slot-store", havingValue = "jpa", matchIfMissing = true)
public class JpaSlotStore implements SlotStore {

    private static final EnumSet<SlotStatus> OCCUPYING =
            EnumSet.of(SlotStatus.BUSY, SlotStatus.BLOCKED, SlotStatus.MAINTENANCE);

    private final SlotRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<Slot> get(String resourceId, LocalDate date) {
        return repository.findByResourceIdAndSlotDateOrderByStartMinuteAsc(resourceId, date);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Slot> getRange(String resourceId, LocalDate from, LocalDate to) {
        return repository.findByResourceIdAndSlotDateBetweenOrderBySlotDateAscStartMinuteAsc(resourceId, from, to);
    }

    @Override
    @Transactional
    public Slot upsert(Slot slot) {
        if (slot.getId() != null) {
            repository.findById(slot.getId())
                    .ifPresent(current -> SlotFragments.requireSameStatus(current, slot));
        }
        try {
            return repository.saveAndFlush(slot);
        } catch (OptimisticLockingFailureException e) {
            throw new StaleSlotException("Slot " + slot.getId() + " was modified concurrently", e);
        }
    }

    @Override
    @Transactional
    public Slot transition(Slot slot, SlotTransition transition) {
        Slot current = repository.findById(slot.getId())
                .orElseThrow(() -> new StaleSlotException("Slot " + slot.getId() + " no longer exists"));
        if (!Objects.equals(current.getVersion(), slot.getVersion())) {
            throw new StaleSlotException(String.format("Slot %d changed (version %d, expected %d)",
                    slot.getId(), current.getVersion(), slot.getVersion()));
        }
        transition.requireAllowedFrom(current.getStatus());
        transition.applyTo(current);
        try {
            Slot saved = repository.saveAndFlush(current);
            log.debug("Slot {} moved to {}", saved.getId(), saved.getStatus());
            return saved;
        } catch (OptimisticLockingFailureException e) {
            throw new StaleSlotException("Slot " + slot.getId() + " was modified concurrently", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Slot> findConflicting(String resourceId, LocalDate date, TimeInterval interval) {
        return repository.findByResourceIdAndSlotDateAndStatusInOrderByStartMinuteAsc(resourceId, date, OCCUPYING)
                .stream()
                .filter(slot -> Intervals.overlaps(Intervals.ofSlot(slot), interval))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Slot> findAvailable(String resourceId, LocalDate date) {
        return repository.findByResourceIdAndSlotDateAndStatusInOrderByStartMinuteAsc(
                resourceId, date, EnumSet.of(SlotStatus.AVAILABLE));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Slot> findByBookingRef(String resourceId, LocalDate date, String bookingRef) {
        return repository.findByResourceIdAndSlotDateAndBookingRefOrderByStartMinuteAsc(resourceId, date, bookingRef);
    }

    @Override
    @Transactional
    public boolean removeIfUnchanged(Slot slot) {
        return repository.deleteIfUnchanged(slot.getId(), slot.getVersion(), SlotStatus.AVAILABLE) == 1;
    }

    @Override
    @Transactional
    public boolean resizeIfUnchanged(Slot slot, int newEndMinute) {
        new TimeInterval(slot.getSlotDate(), slot.getStartMinute(), newEndMinute);
        return repository.resizeIfUnchanged(slot.getId(), slot.getVersion(), SlotStatus.AVAILABLE,
                newEndMinute, LocalDateTime.now()) == 1;
    }

    @Override
    @Transactional
    public List<Slot> split(Slot slot, int atMinute) {
        SlotFragments.requireInside(slot, atMinute);
        if (!resizeIfUnchanged(slot, atMinute)) {
            throw new StaleSlotException("Slot " + slot.getId() + " changed before it could be split");
        }
        Slot head = repository.findById(slot.getId())
                .orElseThrow(() -> new StaleSlotException("Slot " + slot.getId() + " no longer exists"));
        Slot tail = repository.saveAndFlush(Slot.builder()
                .resourceId(head.getResourceId())
                .slotDate(head.getSlotDate())
                .startMinute(atMinute)
                .endMinute(slot.getEndMinute())
                .status(SlotStatus.AVAILABLE)
                .recurring(head.getRecurring())
                .splitFrom(head.lineageId())
                .build());
        log.debug("Slot {} split at {} into {} and {}", slot.getId(), atMinute, head.getId(), tail.getId());
        return List.of(head, tail);
    }
}
