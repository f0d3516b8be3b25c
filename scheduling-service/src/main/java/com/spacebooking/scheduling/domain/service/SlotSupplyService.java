package com.spacebooking.scheduling.domain.service;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.CommitOutcome;
import com.spacebooking.scheduling.domain.model.OperatingHours;
import com.spacebooking.scheduling.domain.model.OptimizationOptions;
import com.spacebooking.scheduling.domain.model.OptimizationResult;
import com.spacebooking.scheduling.domain.model.RecurringPattern;
import com.spacebooking.scheduling.domain.model.ResourceType;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotGenerationOptions;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.model.SlotTransition;
import com.spacebooking.scheduling.domain.store.SlotFragments;
import com.spacebooking.scheduling.domain.store.SlotStore;
import com.spacebooking.scheduling.exception.StaleSlotException;
import com.spacebooking.scheduling.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maintains slot supply: generation into gaps, optimization of free slots and administrative blocking.
 * <p>
 * Every write for a day runs under the same (resource, day) exclusion as commits. Generation only inserts
 * where no slot exists, and optimization only removes or resizes AVAILABLE slots without a booking
 * reference, so booked and blocked time is never touched here except through block/unblock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotSupplyService {

    private final SlotStore slotStore;
    private final SlotGenerator generator;
    private final SlotOptimizer optimizer;
    private final SlotDayExclusion dayExclusion;
    private final ConflictDetector conflictDetector;
    private final ResourceMetadataProvider metadataProvider;
    private final UsageStatsProvider usageStatsProvider;
    private final SchedulingProperties properties;

    public List<Slot> getSlots(String resourceId, LocalDate date) {
        return slotStore.get(resourceId, date);
    }

    /**
     * Generates AVAILABLE slots from operating hours and stores those that overlap no existing slot.
     * Running it twice over the same range creates nothing the second time.
     *
     * @param options null uses {@code scheduling.generation.*}
     * @return the slots actually created
     */
    public List<Slot> generateSlots(String resourceId, LocalDate startDate, LocalDate endDate,
                                    SlotGenerationOptions options) {
        SlotGenerationOptions effective = options != null ? options : defaultGenerationOptions();
        ResourceType type = resolveResourceType(resourceId);
        Map<DayOfWeek, Optional<OperatingHours>> hoursByWeekday = new EnumMap<>(DayOfWeek.class);
        Function<LocalDate, Optional<OperatingHours>> hoursForDay = day -> hoursByWeekday.computeIfAbsent(
                day.getDayOfWeek(), weekday -> resolveOperatingHours(resourceId, type, weekday));

        List<Slot> planned = generator.generate(resourceId, startDate, endDate, hoursForDay, effective);
        List<Slot> created = fillGaps(resourceId, planned);
        log.info("Generated {} slot(s) for resource {} between {} and {} ({} planned)",
                created.size(), resourceId, startDate, endDate, planned.size());
        return created;
    }

    public List<Slot> generateRecurring(String resourceId, LocalDate startDate, LocalDate endDate,
                                        TimeInterval dailyWindow, RecurringPattern pattern) {
        List<Slot> planned = generator.generateRecurring(resourceId, startDate, endDate,
                dailyWindow.startMinute(), dailyWindow.endMinute(), pattern);
        List<Slot> created = fillGaps(resourceId, planned);
        log.info("Generated {} recurring slot(s) ({}) for resource {} between {} and {}",
                created.size(), pattern.frequency(), resourceId, startDate, endDate);
        return created;
    }

    /**
     * Applies demand signal, per-day limit and consolidation to the free slots in {@code [from, to]}.
     */
    public OptimizationResult optimize(String resourceId, LocalDate from, LocalDate to, OptimizationOptions options) {
        if (to.isBefore(from)) {
            throw new BusinessException(
                    "Invalid date range: " + from + " to " + to, "INVALID_DATE_RANGE");
        }
        List<String> recommendations = new ArrayList<>();
        int originalCount = slotStore.getRange(resourceId, from, to).size();

        Map<Integer, Double> utilization = Map.of();
        if (options.useDemandSignal()) {
            utilization = loadUtilization(resourceId, from);
            if (utilization.isEmpty()) {
                recommendations.add("Usage statistics unavailable; demand signal was not applied");
            }
        }

        int removed = 0;
        int merged = 0;
        int skipped = 0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            LocalDate current = day;
            Map<Integer, Double> dayUtilization = utilization;
            DayOptimization result;
            try {
                result = dayExclusion.execute(resourceId, day,
                        () -> optimizeDay(resourceId, current, options, dayUtilization));
            } catch (StaleSlotException e) {
                log.warn("Slots of resource {} on {} changed during optimization, day left as it was: {}",
                        resourceId, day, e.getMessage());
                result = new DayOptimization(0, 0, 1);
            }
            removed += result.removed();
            merged += result.merged();
            skipped += result.skipped();
        }

        int optimizedCount = slotStore.getRange(resourceId, from, to).size();
        double efficiency = originalCount == 0 ? 100.0 : BigDecimal.valueOf(optimizedCount * 100.0 / originalCount)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();

        if (removed > 0) {
            recommendations.add("Removed " + removed + " low-demand or surplus slot(s)");
        }
        if (merged > 0) {
            recommendations.add("Merged " + merged + " adjacent free slot(s) into longer blocks");
        }
        if (skipped > 0) {
            recommendations.add(skipped + " slot(s) changed during optimization and were left as they are");
        }
        recommendations.addAll(typeRecommendations(resolveResourceType(resourceId)));
        if (removed == 0 && merged == 0) {
            recommendations.add("Slot supply is already optimal for the selected options");
        }

        log.info("Optimized slots of resource {} between {} and {}: {} -> {} ({} removed, {} merged)",
                resourceId, from, to, originalCount, optimizedCount, removed, merged);
        return new OptimizationResult(originalCount, optimizedCount, efficiency, recommendations);
    }

    /**
     * Blocks every slot overlapping {@code interval} and fills uncovered time with BLOCKED slots.
     * Refused with a conflict report when a BUSY slot overlaps; BLOCKED and MAINTENANCE slots are left as they are.
     */
    public CommitOutcome block(String resourceId, LocalDate date, TimeInterval interval, String reason,
                               String blockedBy) {
        ConflictDetector.requireSameDay(date, interval);
        CommitOutcome outcome = dayExclusion.execute(resourceId, date, () -> {
            List<Slot> overlapping = overlapping(resourceId, date, interval);
            List<Slot> busy = overlapping.stream()
                    .filter(slot -> slot.getStatus() == SlotStatus.BUSY)
                    .toList();
            if (!busy.isEmpty()) {
                return CommitOutcome.conflict(conflictDetector.classify(busy));
            }

            List<Slot> blocked = new ArrayList<>();
            for (Slot slot : overlapping) {
                if (slot.getStatus() == SlotStatus.AVAILABLE) {
                    Slot piece = SlotFragments.carve(slotStore, slot, interval);
                    blocked.add(slotStore.transition(piece, SlotTransition.toBlocked(reason, blockedBy)));
                } else if (slot.getStatus() == SlotStatus.BLOCKED) {
                    blocked.add(slot);
                }
            }
            List<TimeInterval> gaps = Intervals.uncovered(interval, overlapping.stream().map(Intervals::ofSlot).toList());
            for (TimeInterval gap : gaps) {
                blocked.add(slotStore.upsert(Slot.builder()
                        .resourceId(resourceId)
                        .slotDate(date)
                        .startMinute(gap.startMinute())
                        .endMinute(gap.endMinute())
                        .status(SlotStatus.BLOCKED)
                        .blockedReason(reason)
                        .blockedBy(blockedBy)
                        .build()));
            }
            return CommitOutcome.committed(blocked, false);
        });
        if (outcome.isCommitted()) {
            log.info("Blocked {} on resource {} by {}: {}", interval, resourceId, blockedBy, reason);
        } else {
            log.info("Block of {} on resource {} refused: overlaps booked time", interval, resourceId);
        }
        return outcome;
    }

    /**
     * Returns BLOCKED slots overlapping {@code interval} to AVAILABLE.
     */
    public List<Slot> unblock(String resourceId, LocalDate date, TimeInterval interval) {
        ConflictDetector.requireSameDay(date, interval);
        List<Slot> unblocked = dayExclusion.execute(resourceId, date, () -> {
            List<Slot> changed = new ArrayList<>();
            for (Slot slot : overlapping(resourceId, date, interval)) {
                if (slot.getStatus() == SlotStatus.BLOCKED) {
                    changed.add(slotStore.transition(slot, SlotTransition.toAvailable()));
                }
            }
            if (!changed.isEmpty()) {
                SlotFragments.rejoin(slotStore, resourceId, date,
                        changed.stream().map(Slot::lineageId).collect(Collectors.toSet()));
            }
            return changed;
        });
        log.info("Unblocked {} slot(s) on resource {} at {}", unblocked.size(), resourceId, interval);
        return unblocked;
    }

    public SlotGenerationOptions defaultGenerationOptions() {
        SchedulingProperties.Generation generation = properties.getGeneration();
        return new SlotGenerationOptions(generation.getSlotDurationMinutes(), generation.getBreakMinutes(),
                generation.getMaxSlotsPerDay());
    }

    private List<Slot> fillGaps(String resourceId, List<Slot> planned) {
        Map<LocalDate, List<Slot>> plannedByDay = planned.stream()
                .collect(Collectors.groupingBy(Slot::getSlotDate, TreeMap::new, Collectors.toList()));

        List<Slot> created = new ArrayList<>();
        for (Map.Entry<LocalDate, List<Slot>> entry : plannedByDay.entrySet()) {
            created.addAll(dayExclusion.execute(resourceId, entry.getKey(), () -> {
                List<TimeInterval> occupied = new ArrayList<>(slotStore.get(resourceId, entry.getKey()).stream()
                        .map(Intervals::ofSlot)
                        .toList());
                List<Slot> inserted = new ArrayList<>();
                for (Slot candidate : entry.getValue()) {
                    TimeInterval candidateInterval = Intervals.ofSlot(candidate);
                    if (occupied.stream().noneMatch(existing -> Intervals.overlaps(existing, candidateInterval))) {
                        inserted.add(slotStore.upsert(candidate));
                        occupied.add(candidateInterval);
                    }
                }
                return inserted;
            }));
        }
        return created;
    }

    private DayOptimization optimizeDay(String resourceId, LocalDate day, OptimizationOptions options,
                                        Map<Integer, Double> utilization) {
        List<Slot> free = slotStore.get(resourceId, day).stream()
                .filter(optimizer::isFreeSupply)
                .toList();
        if (free.isEmpty()) {
            return new DayOptimization(0, 0, 0);
        }

        List<Slot> target = free;
        if (options.useDemandSignal()) {
            target = optimizer.applyDemandSignal(target, utilization);
        }
        if (options.maxSlotsPerDay() != null) {
            target = optimizer.limitSlotsPerDay(target, options.maxSlotsPerDay());
        }

        Set<Long> keptIds = target.stream().map(Slot::getId).collect(Collectors.toSet());
        int removed = 0;
        int skipped = 0;
        for (Slot slot : free) {
            if (!keptIds.contains(slot.getId())) {
                if (slotStore.removeIfUnchanged(slot)) {
                    removed++;
                } else {
                    skipped++;
                }
            }
        }

        int merged = 0;
        if (options.consolidate()) {
            for (Slot run : optimizer.consolidate(target)) {
                List<Slot> absorbed = target.stream()
                        .filter(slot -> !slot.getId().equals(run.getId()))
                        .filter(slot -> Intervals.overlaps(Intervals.ofSlot(slot), Intervals.ofSlot(run)))
                        .sorted(Comparator.comparing(Slot::getStartMinute))
                        .toList();
                if (absorbed.isEmpty()) {
                    continue;
                }
                Slot first = target.stream().filter(slot -> slot.getId().equals(run.getId())).findFirst().orElseThrow();
                int removedFromRun = SlotFragments.absorb(slotStore, first, absorbed);
                merged += removedFromRun;
                skipped += absorbed.size() - removedFromRun;
            }
        }
        return new DayOptimization(removed, merged, skipped);
    }

    private List<Slot> overlapping(String resourceId, LocalDate date, TimeInterval interval) {
        return slotStore.get(resourceId, date).stream()
                .filter(slot -> Intervals.overlaps(Intervals.ofSlot(slot), interval))
                .toList();
    }

    private Map<Integer, Double> loadUtilization(String resourceId, LocalDate from) {
        int lookback = properties.getOptimizer().getUsageLookbackDays();
        try {
            return usageStatsProvider.getHourlyUtilization(resourceId, from.minusDays(lookback), from.minusDays(1));
        } catch (UpstreamUnavailableException e) {
            log.warn("Usage statistics unavailable for resource {}; keeping all free slots", resourceId);
            return Map.of();
        }
    }

    ResourceType resolveResourceType(String resourceId) {
        try {
            return metadataProvider.getResourceType(resourceId);
        } catch (UpstreamUnavailableException e) {
            log.warn("Resource type unavailable for {}; using defaults for {}", resourceId, ResourceType.OTHER);
            return ResourceType.OTHER;
        }
    }

    private Optional<OperatingHours> resolveOperatingHours(String resourceId, ResourceType type, DayOfWeek weekday) {
        try {
            return metadataProvider.getOperatingHours(resourceId, weekday);
        } catch (UpstreamUnavailableException e) {
            log.warn("Operating hours unavailable for resource {} on {}; using {} defaults", resourceId, weekday, type);
            return Optional.of(defaultHours(type));
        }
    }

    private OperatingHours defaultHours(ResourceType type) {
        SchedulingProperties.Generation generation = properties.getGeneration();
        SchedulingProperties.Hours hours = generation.getDefaultHours().getOrDefault(type, generation.getFallbackHours());
        return OperatingHours.of(hours.getOpen(), hours.getClose());
    }

    private static List<String> typeRecommendations(ResourceType type) {
        return switch (type) {
            case MEETING_ROOM -> List.of("Consider 30-minute slots for meeting rooms to raise utilization");
            case EVENT_SPACE -> List.of("Consider longer slots (4 hours or more) for event spaces");
            case SHARED_DESK -> List.of("Consider half-day slots for shared desks");
            default -> List.of();
        };
    }

    private record DayOptimization(int removed, int merged, int skipped) {
    }
}
