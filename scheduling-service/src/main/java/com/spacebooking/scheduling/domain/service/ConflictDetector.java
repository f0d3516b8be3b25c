package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Conflict;
import com.spacebooking.scheduling.domain.model.ConflictReport;
import com.spacebooking.scheduling.domain.model.ConflictSeverity;
import com.spacebooking.scheduling.domain.model.ConflictType;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.store.SlotStore;
import com.spacebooking.scheduling.exception.InvalidIntervalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds what stands in the way of a requested interval. Lock-free read; the answer may be stale by the time
 * the caller acts on it, which is why commit re-checks under the day's exclusion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictDetector {

    private final SlotStore slotStore;

    /**
     * @param excludeBookingId slots held by this booking are not conflicts (rescheduling); may be null
     */
    public ConflictReport checkConflicts(String resourceId, LocalDate date, TimeInterval interval,
                                         String excludeBookingId) {
        requireSameDay(date, interval);
        List<Slot> blocking = slotStore.findConflicting(resourceId, date, interval).stream()
                .filter(slot -> excludeBookingId == null || !excludeBookingId.equals(slot.getBookingRef()))
                .toList();
        ConflictReport report = classify(blocking);
        log.debug("Conflict check for resource {} at {}: {} conflict(s)", resourceId, interval,
                report.conflicts().size());
        return report;
    }

    /**
     * Builds a report from slots already known to block the request.
     */
    public ConflictReport classify(List<Slot> blocking) {
        List<Conflict> conflicts = blocking.stream()
                .map(this::toConflict)
                .toList();
        return ConflictReport.of(conflicts, suggestionsFor(conflicts));
    }

    static void requireSameDay(LocalDate date, TimeInterval interval) {
        if (!Objects.equals(date, interval.date())) {
            throw new InvalidIntervalException(
                    "Interval " + interval + " does not belong to " + date);
        }
    }

    private Conflict toConflict(Slot slot) {
        TimeInterval interval = Intervals.ofSlot(slot);
        return switch (slot.getStatus()) {
            case BLOCKED -> new Conflict(slot.getId(), interval, ConflictType.BLOCKED, ConflictSeverity.HIGH,
                    slot.getBlockedReason() != null ? slot.getBlockedReason() : "Slot blocked");
            case BUSY -> new Conflict(slot.getId(), interval, ConflictType.BUSY, ConflictSeverity.MEDIUM,
                    "Slot occupied by another booking");
            case MAINTENANCE -> new Conflict(slot.getId(), interval, ConflictType.MAINTENANCE, ConflictSeverity.LOW,
                    "Resource under maintenance");
            case AVAILABLE -> throw new IllegalArgumentException("Available slot " + slot.getId() + " is not a conflict");
        };
    }

    private List<String> suggestionsFor(List<Conflict> conflicts) {
        List<String> suggestions = new ArrayList<>();
        if (conflicts.isEmpty()) {
            return suggestions;
        }
        if (conflicts.stream().anyMatch(conflict -> conflict.type() == ConflictType.BUSY)) {
            suggestions.add("Try a different time on the same day");
            suggestions.add("Consider booking the same time on another day");
        }
        if (conflicts.stream().anyMatch(conflict -> conflict.type() == ConflictType.BLOCKED)) {
            suggestions.add("This time is blocked by an administrator; choose another time");
        }
        if (conflicts.stream().anyMatch(conflict -> conflict.type() == ConflictType.MAINTENANCE)) {
            suggestions.add("The resource is under maintenance; try another resource or date");
        }
        if (conflicts.size() > 1) {
            suggestions.add("Several conflicts found; a shorter booking may fit");
        }
        return suggestions;
    }
}
