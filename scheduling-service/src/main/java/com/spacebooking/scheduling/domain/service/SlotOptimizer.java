package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reshapes slot supply. Pure list transformations: inputs are never mutated and nothing is persisted here.
 * Merged slots keep the id and version of the first slot of their run.
 */
@Component
@RequiredArgsConstructor
public class SlotOptimizer {

    private static final Comparator<Slot> BY_POSITION = Comparator
            .comparing(Slot::getResourceId)
            .thenComparing(Slot::getSlotDate)
            .thenComparing(Slot::getStartMinute);

    private final SlotScorer scorer;
    private final SchedulingProperties properties;

    /**
     * Merges runs of touching slots ({@code end == next.start}) with the same resource, day and status.
     * BUSY slots merge only within one booking, BLOCKED slots only with the same reason and author.
     */
    public List<Slot> consolidate(List<Slot> slots) {
        List<Slot> sorted = slots.stream().sorted(BY_POSITION).toList();
        List<Slot> merged = new ArrayList<>();
        Slot current = null;
        for (Slot slot : sorted) {
            if (current != null && canMerge(current, slot)) {
                current.setEndMinute(slot.getEndMinute());
            } else {
                current = slot.toBuilder().build();
                merged.add(current);
            }
        }
        return merged;
    }

    /**
     * Drops free supply in hours that historically go unused. Only AVAILABLE slots without a booking reference
     * and outside peak windows are candidates; an empty utilization map keeps everything.
     *
     * @param utilization hour of day (0-23) to utilization ratio (0.0-1.0)
     */
    public List<Slot> applyDemandSignal(List<Slot> slots, Map<Integer, Double> utilization) {
        if (utilization == null || utilization.isEmpty()) {
            return List.copyOf(slots);
        }
        double threshold = properties.getOptimizer().getLowDemandThreshold();
        return slots.stream()
                .filter(slot -> {
                    if (!isFreeSupply(slot)) {
                        return true;
                    }
                    int hour = slot.getStartMinute() / 60;
                    if (scorer.isPeakHour(hour)) {
                        return true;
                    }
                    return utilization.getOrDefault(hour, 0.0) >= threshold;
                })
                .toList();
    }

    /**
     * Keeps at most {@code maxPerDay} free slots per resource and day, preferring higher scores
     * (ties: earlier start). Occupied slots are always kept and do not count against the limit.
     */
    public List<Slot> limitSlotsPerDay(List<Slot> slots, int maxPerDay) {
        Map<String, List<Slot>> freeByDay = slots.stream()
                .filter(this::isFreeSupply)
                .collect(Collectors.groupingBy(slot -> dayKey(slot.getResourceId(), slot.getSlotDate()),
                        LinkedHashMap::new, Collectors.toList()));

        Set<Slot> keep = new HashSet<>();
        for (List<Slot> daySlots : freeByDay.values()) {
            daySlots.stream()
                    .sorted(Comparator.comparingInt((Slot slot) -> scorer.score(Intervals.ofSlot(slot)))
                            .reversed()
                            .thenComparing(Slot::getStartMinute))
                    .limit(Math.max(maxPerDay, 0))
                    .forEach(keep::add);
        }
        return slots.stream()
                .filter(slot -> !isFreeSupply(slot) || keep.contains(slot))
                .sorted(BY_POSITION)
                .toList();
    }

    boolean isFreeSupply(Slot slot) {
        return slot.getStatus() == SlotStatus.AVAILABLE && slot.getBookingRef() == null;
    }

    private boolean canMerge(Slot left, Slot right) {
        if (!left.getResourceId().equals(right.getResourceId())
                || !left.getSlotDate().equals(right.getSlotDate())
                || left.getStatus() != right.getStatus()
                || !left.getEndMinute().equals(right.getStartMinute())
                || !Objects.equals(left.getRecurring(), right.getRecurring())) {
            return false;
        }
        return switch (left.getStatus()) {
            case BUSY -> left.getBookingRef() != null && left.getBookingRef().equals(right.getBookingRef());
            case BLOCKED -> Objects.equals(left.getBlockedReason(), right.getBlockedReason())
                    && Objects.equals(left.getBlockedBy(), right.getBlockedBy());
            case AVAILABLE -> left.getBookingRef() == null && right.getBookingRef() == null;
            case MAINTENANCE -> true;
        };
    }

    private static String dayKey(String resourceId, LocalDate date) {
        return resourceId + "|" + date;
    }
}
