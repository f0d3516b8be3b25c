package com.spacebooking.scheduling.domain.service;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.BookingStatus;
import com.spacebooking.scheduling.domain.model.CommitOutcome;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.model.SlotTransition;
import com.spacebooking.scheduling.domain.store.SlotFragments;
import com.spacebooking.scheduling.domain.store.SlotStore;
import com.spacebooking.scheduling.events.SlotEventPublisher;
import com.spacebooking.scheduling.exception.CommitFailedException;
import com.spacebooking.scheduling.exception.StaleSlotException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Commits intervals to bookings and releases them again.
 * <p>
 * Flow of a commit attempt, under the (resource, day) exclusion:
 * 1. Read the day's slots fresh
 * 2. Anything non-free held by another booking: return a conflict report
 * 3. Same booking already holds the whole interval: idempotent replay
 * 4. Overlapping AVAILABLE slots are cut to the interval and become BUSY, uncovered gaps get new BUSY slots
 * <p>
 * Releasing joins freed pieces back with the free remainders they were cut from.
 * <p>
 * A {@link StaleSlotException} (version mismatch or lock wait timeout) repeats the whole attempt with
 * exponential backoff; exhausting the attempts raises {@link CommitFailedException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotCommitService {

    private final SlotDayExclusion dayExclusion;
    private final SlotStore slotStore;
    private final ConflictDetector conflictDetector;
    private final SlotEventPublisher eventPublisher;

    @Value("${scheduling.commit.max-attempts:3}")
    private int maxAttempts;

    @Value("${scheduling.commit.backoff-initial-ms:50}")
    private long backoffInitialMs;

    @Value("${scheduling.commit.backoff-max-ms:500}")
    private long backoffMaxMs;

    private RetryTemplate retryTemplate;

    @PostConstruct
    public void init() {
        retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(backoffInitialMs, 2.0, backoffMaxMs)
                .retryOn(StaleSlotException.class)
                .traversingCauses()
                .build();
        log.info("Initialized SlotCommitService with {} attempts per commit", maxAttempts);
    }

    public CommitOutcome commit(String resourceId, LocalDate date, TimeInterval interval, String bookingId) {
        ConflictDetector.requireSameDay(date, interval);
        requireBookingId(bookingId);

        CommitOutcome outcome = executeWithRetry("commit", resourceId, date,
                () -> doCommit(resourceId, date, interval, bookingId));

        if (outcome.isCommitted() && !outcome.replayed()) {
            log.info("Committed {} for booking {} on resource {} ({} slot(s))",
                    interval, bookingId, resourceId, outcome.slots().size());
            eventPublisher.publishSlotsCommitted(resourceId, interval, bookingId, outcome.slots());
        } else if (outcome.replayed()) {
            log.info("Commit of {} for booking {} on resource {} already applied", interval, bookingId, resourceId);
        } else {
            log.info("Commit of {} for booking {} on resource {} refused: {} conflict(s)",
                    interval, bookingId, resourceId, outcome.conflictReport().conflicts().size());
        }
        return outcome;
    }

    /**
     * Returns the booking's BUSY slots overlapping {@code interval} to AVAILABLE.
     * Releasing something that is not held is a no-op.
     *
     * @return the slots that were released
     */
    public List<Slot> release(String resourceId, LocalDate date, TimeInterval interval, String bookingId) {
        ConflictDetector.requireSameDay(date, interval);
        requireBookingId(bookingId);

        List<Slot> released = executeWithRetry("release", resourceId, date, () -> {
            List<Slot> changed = new ArrayList<>();
            for (Slot slot : slotStore.findByBookingRef(resourceId, date, bookingId)) {
                if (slot.getStatus() == SlotStatus.BUSY && Intervals.overlaps(Intervals.ofSlot(slot), interval)) {
                    changed.add(slotStore.transition(slot, SlotTransition.toAvailable()));
                }
            }
            if (!changed.isEmpty()) {
                Set<Long> lineages = changed.stream().map(Slot::lineageId).collect(Collectors.toSet());
                SlotFragments.rejoin(slotStore, resourceId, date, lineages);
            }
            return changed;
        });

        if (released.isEmpty()) {
            log.debug("Nothing to release for booking {} on resource {} at {}", bookingId, resourceId, interval);
        } else {
            log.info("Released {} slot(s) of booking {} on resource {}", released.size(), bookingId, resourceId);
            eventPublisher.publishSlotsReleased(resourceId, interval, bookingId, released);
        }
        return released;
    }

    /**
     * Applies a lifecycle change reported by the booking service. A status that no longer occupies the
     * interval releases the booking's slots; any other status leaves them as they are.
     *
     * @return the slots that were released
     */
    public List<Slot> applyBookingStatus(String resourceId, LocalDate date, TimeInterval interval,
                                         String bookingId, BookingStatus status) {
        if (status == null) {
            throw new BusinessException("Booking status is required", "BOOKING_STATUS_REQUIRED");
        }
        if (status.occupiesInterval()) {
            log.debug("Booking {} is {}, slots on resource {} stay held", bookingId, status, resourceId);
            return List.of();
        }
        return release(resourceId, date, interval, bookingId);
    }

    private CommitOutcome doCommit(String resourceId, LocalDate date, TimeInterval interval, String bookingId) {
        List<Slot> overlapping = slotStore.get(resourceId, date).stream()
                .filter(slot -> Intervals.overlaps(Intervals.ofSlot(slot), interval))
                .toList();

        List<Slot> blocking = overlapping.stream()
                .filter(slot -> slot.getStatus() != SlotStatus.AVAILABLE)
                .filter(slot -> !(slot.getStatus() == SlotStatus.BUSY && bookingId.equals(slot.getBookingRef())))
                .toList();
        if (!blocking.isEmpty()) {
            return CommitOutcome.conflict(conflictDetector.classify(blocking));
        }

        List<Slot> held = overlapping.stream()
                .filter(slot -> slot.getStatus() == SlotStatus.BUSY)
                .toList();
        List<Slot> free = overlapping.stream()
                .filter(slot -> slot.getStatus() == SlotStatus.AVAILABLE)
                .toList();
        List<TimeInterval> gaps = Intervals.uncovered(interval, overlapping.stream().map(Intervals::ofSlot).toList());

        if (!held.isEmpty() && free.isEmpty() && gaps.isEmpty()) {
            return CommitOutcome.committed(held, true);
        }

        List<Slot> committed = new ArrayList<>(held);
        for (Slot slot : free) {
            Slot piece = SlotFragments.carve(slotStore, slot, interval);
            committed.add(slotStore.transition(piece, SlotTransition.toBusy(bookingId)));
        }
        for (TimeInterval gap : gaps) {
            committed.add(slotStore.upsert(Slot.builder()
                    .resourceId(resourceId)
                    .slotDate(date)
                    .startMinute(gap.startMinute())
                    .endMinute(gap.endMinute())
                    .status(SlotStatus.BUSY)
                    .bookingRef(bookingId)
                    .build()));
        }
        committed.sort(Comparator.comparing(Slot::getStartMinute));
        return CommitOutcome.committed(committed, false);
    }

    private <T> T executeWithRetry(String operation, String resourceId, LocalDate date, Supplier<T> work) {
        return retryTemplate.execute(
                context -> {
                    if (context.getRetryCount() > 0) {
                        log.debug("Retrying {} on resource {} for {} (attempt {})",
                                operation, resourceId, date, context.getRetryCount() + 1);
                    }
                    return dayExclusion.execute(resourceId, date, work);
                },
                context -> {
                    Throwable last = context.getLastThrowable();
                    if (!causedByStaleSlot(last) && last instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    log.warn("Giving up {} on resource {} for {} after {} attempt(s)",
                            operation, resourceId, date, context.getRetryCount());
                    throw new CommitFailedException(String.format(
                            "Could not %s slots of resource %s on %s after %d attempts; please retry",
                            operation, resourceId, date, context.getRetryCount()), last);
                });
    }

    private static boolean causedByStaleSlot(Throwable throwable) {
        for (Throwable current = throwable; current != null; current = current.getCause()) {
            if (current instanceof StaleSlotException) {
                return true;
            }
        }
        return false;
    }

    private static void requireBookingId(String bookingId) {
        if (bookingId == null || bookingId.isBlank()) {
            throw new BusinessException("Booking id is required", "BOOKING_ID_REQUIRED");
        }
    }
}
