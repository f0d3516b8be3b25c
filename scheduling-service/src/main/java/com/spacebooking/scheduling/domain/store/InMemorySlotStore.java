package com.spacebooking.scheduling.domain.store;

import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.model.SlotTransition;
import com.spacebooking.scheduling.exception.StaleSlotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Process-local slot store for single-node deployments and tests.
 * Callers only ever see copies; writes are serialized and version-checked against the stored copy.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scheduling.slot-store", havingValue = "memory")
public class InMemorySlotStore implements SlotStore {

    private static final Comparator<Slot> BY_DAY_AND_START = Comparator
            .comparing(Slot::getSlotDate)
            .thenComparing(Slot::getStartMinute);

    private final Map<Long, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public List<Slot> get(String resourceId, LocalDate date) {
        return select(slot -> slot.getResourceId().equals(resourceId) && slot.getSlotDate().equals(date));
    }

    @Override
    public List<Slot> getRange(String resourceId, LocalDate from, LocalDate to) {
        return select(slot -> slot.getResourceId().equals(resourceId)
                && !slot.getSlotDate().isBefore(from)
                && !slot.getSlotDate().isAfter(to));
    }

    @Override
    public synchronized Slot upsert(Slot slot) {
        LocalDateTime now = LocalDateTime.now();
        Slot stored = slot.toBuilder().updatedAt(now).build();
        if (slot.getId() == null) {
            stored.setId(idSequence.incrementAndGet());
            stored.setVersion(0L);
            stored.setCreatedAt(now);
            if (stored.getStatus() == null) {
                stored.setStatus(SlotStatus.AVAILABLE);
            }
        } else {
            Slot current = requireUnchanged(slot);
            SlotFragments.requireSameStatus(current, stored);
            stored.setCreatedAt(current.getCreatedAt());
            stored.setVersion(current.getVersion() + 1);
        }
        slots.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Slot transition(Slot slot, SlotTransition transition) {
        Slot current = requireUnchanged(slot);
        transition.requireAllowedFrom(current.getStatus());
        Slot next = copy(current);
        transition.applyTo(next);
        next.setVersion(current.getVersion() + 1);
        next.setUpdatedAt(LocalDateTime.now());
        slots.put(next.getId(), next);
        log.debug("Slot {} moved to {}", next.getId(), next.getStatus());
        return copy(next);
    }

    @Override
    public List<Slot> findConflicting(String resourceId, LocalDate date, TimeInterval interval) {
        return get(resourceId, date).stream()
                .filter(slot -> slot.getStatus() != SlotStatus.AVAILABLE)
                .filter(slot -> Intervals.overlaps(Intervals.ofSlot(slot), interval))
                .toList();
    }

    @Override
    public List<Slot> findAvailable(String resourceId, LocalDate date) {
        return get(resourceId, date).stream()
                .filter(slot -> slot.getStatus() == SlotStatus.AVAILABLE)
                .toList();
    }

    @Override
    public List<Slot> findByBookingRef(String resourceId, LocalDate date, String bookingRef) {
        return get(resourceId, date).stream()
                .filter(slot -> Objects.equals(slot.getBookingRef(), bookingRef))
                .toList();
    }

    @Override
    public synchronized boolean removeIfUnchanged(Slot slot) {
        if (!isUntouchedFreeSlot(slot)) {
            return false;
        }
        slots.remove(slot.getId());
        return true;
    }

    @Override
    public synchronized boolean resizeIfUnchanged(Slot slot, int newEndMinute) {
        new TimeInterval(slot.getSlotDate(), slot.getStartMinute(), newEndMinute);
        if (!isUntouchedFreeSlot(slot)) {
            return false;
        }
        Slot current = slots.get(slot.getId());
        Slot resized = current.toBuilder()
                .endMinute(newEndMinute)
                .version(current.getVersion() + 1)
                .updatedAt(LocalDateTime.now())
                .build();
        slots.put(resized.getId(), resized);
        return true;
    }

    @Override
    public synchronized List<Slot> split(Slot slot, int atMinute) {
        SlotFragments.requireInside(slot, atMinute);
        if (!isUntouchedFreeSlot(slot)) {
            throw new StaleSlotException("Slot " + slot.getId() + " changed before it could be split");
        }
        LocalDateTime now = LocalDateTime.now();
        Slot current = slots.get(slot.getId());
        Slot head = current.toBuilder()
                .endMinute(atMinute)
                .version(current.getVersion() + 1)
                .updatedAt(now)
                .build();
        Slot tail = current.toBuilder()
                .id(idSequence.incrementAndGet())
                .startMinute(atMinute)
                .splitFrom(current.lineageId())
                .version(0L)
                .createdAt(now)
                .updatedAt(now)
                .build();
        slots.put(head.getId(), head);
        slots.put(tail.getId(), tail);
        log.debug("Slot {} split at {} into {} and {}", slot.getId(), atMinute, head.getId(), tail.getId());
        return List.of(copy(head), copy(tail));
    }

    private boolean isUntouchedFreeSlot(Slot slot) {
        Slot current = slots.get(slot.getId());
        return current != null
                && Objects.equals(current.getVersion(), slot.getVersion())
                && current.getStatus() == SlotStatus.AVAILABLE
                && current.getBookingRef() == null;
    }

    private Slot requireUnchanged(Slot slot) {
        Slot current = slots.get(slot.getId());
        if (current == null) {
            throw new StaleSlotException("Slot " + slot.getId() + " no longer exists");
        }
        if (!Objects.equals(current.getVersion(), slot.getVersion())) {
            throw new StaleSlotException(String.format("Slot %d changed (version %d, expected %d)",
                    slot.getId(), current.getVersion(), slot.getVersion()));
        }
        return current;
    }

    private List<Slot> select(Predicate<Slot> filter) {
        return slots.values().stream()
                .filter(filter)
                .sorted(BY_DAY_AND_START)
                .map(this::copy)
                .toList();
    }

    private Slot copy(Slot slot) {
        return slot.toBuilder().build();
    }
}
