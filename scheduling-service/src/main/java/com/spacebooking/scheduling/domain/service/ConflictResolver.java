package com.spacebooking.scheduling.domain.service;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.Alternative;
import com.spacebooking.scheduling.domain.model.ResolutionOptions;
import com.spacebooking.scheduling.domain.model.ResolutionOutcome;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import com.spacebooking.scheduling.domain.store.SlotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Proposes a way around a conflicting request: first the same day shifted in time, then other days.
 * Also answers the open-ended question of the best free times for a duration on one day.
 * <p>
 * Holds no lock. A {@link ResolutionOutcome.Resolved} interval was conflict-free when checked; date-shift
 * alternatives are advisory and only a later commit makes either of them stick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictResolver {

    private static final Comparator<Alternative> RANKING = Comparator
            .comparingInt(Alternative::score).reversed()
            .thenComparing(Alternative::date)
            .thenComparingInt(alternative -> alternative.interval().startMinute());

    private final ConflictDetector conflictDetector;
    private final SlotStore slotStore;
    private final SlotScorer scorer;
    private final SchedulingProperties properties;

    public ResolutionOutcome resolveConflicts(String resourceId, LocalDate date, TimeInterval interval,
                                              ResolutionOptions options) {
        ConflictDetector.requireSameDay(date, interval);
        String excluded = options.excludeBookingId();

        if (conflictDetector.checkConflicts(resourceId, date, interval, excluded).canProceed()) {
            return new ResolutionOutcome.Resolved(interval, 0, "Requested time is available");
        }

        if (options.allowTimeShift()) {
            Optional<ResolutionOutcome.Resolved> shifted = tryTimeShift(resourceId, date, interval, excluded);
            if (shifted.isPresent()) {
                log.debug("Resolved conflict for resource {} by shifting {} to {}",
                        resourceId, interval, shifted.get().newInterval());
                return shifted.get();
            }
        }

        if (options.allowDateShift()) {
            List<Alternative> alternatives = findAlternatives(resourceId, interval, options);
            if (!alternatives.isEmpty()) {
                log.debug("Found {} alternative(s) for resource {} at {}", alternatives.size(), resourceId, interval);
                return new ResolutionOutcome.AlternativesFound(alternatives);
            }
        }

        return new ResolutionOutcome.ManualActionRequired(
                "No conflict-free time found automatically; please choose another time or resource");
    }

    /**
     * Best conflict-free times of {@code durationMinutes} on one day, best first.
     * <p>
     * Candidates start every {@code scheduling.resolver.search-step-minutes} inside {@code window}, or inside the
     * configured search window when {@code window} is null. Anything overlapping BUSY, BLOCKED or MAINTENANCE time
     * is skipped; a candidate matching an existing free slot exactly earns the exact-duration bonus.
     */
    public List<Alternative> findOptimalTimes(String resourceId, LocalDate date, int durationMinutes,
                                              TimeInterval window) {
        if (durationMinutes <= 0) {
            throw new BusinessException("Duration must be positive: " + durationMinutes, "INVALID_DURATION");
        }
        SchedulingProperties.Resolver settings = properties.getResolver();
        TimeInterval searchWindow = window != null
                ? window
                : TimeInterval.of(date, settings.getSearchOpen(), settings.getSearchClose());
        ConflictDetector.requireSameDay(date, searchWindow);

        List<TimeInterval> occupied = slotStore.findConflicting(resourceId, date, searchWindow).stream()
                .map(Intervals::ofSlot)
                .toList();
        Set<TimeInterval> freeSlots = slotStore.findAvailable(resourceId, date).stream()
                .map(Intervals::ofSlot)
                .collect(Collectors.toSet());

        int step = Math.max(1, settings.getSearchStepMinutes());
        List<Alternative> times = new ArrayList<>();
        for (int start = searchWindow.startMinute(); start + durationMinutes <= searchWindow.endMinute(); start += step) {
            TimeInterval candidate = new TimeInterval(date, start, start + durationMinutes);
            if (occupied.stream().anyMatch(busy -> Intervals.overlaps(busy, candidate))) {
                continue;
            }
            int score = scorer.score(candidate);
            if (freeSlots.contains(candidate)) {
                score += settings.getExactDurationBonus();
            }
            times.add(new Alternative(date, candidate, score, describeTime(candidate, score)));
        }
        log.debug("Found {} free start time(s) of {} minutes for resource {} on {}",
                times.size(), durationMinutes, resourceId, date);
        return times.stream()
                .sorted(RANKING)
                .limit(settings.getMaxOptimalTimes())
                .toList();
    }

    private Optional<ResolutionOutcome.Resolved> tryTimeShift(String resourceId, LocalDate date,
                                                              TimeInterval interval, String excluded) {
        for (int shift : properties.getResolver().getTimeShifts()) {
            Optional<TimeInterval> candidate = Intervals.shift(interval, shift);
            if (candidate.isEmpty()) {
                continue;
            }
            if (conflictDetector.checkConflicts(resourceId, date, candidate.get(), excluded).canProceed()) {
                String message = String.format("Shifted by %+d minutes to %s-%s", shift,
                        Intervals.formatMinutes(candidate.get().startMinute()),
                        Intervals.formatMinutes(candidate.get().endMinute()));
                return Optional.of(new ResolutionOutcome.Resolved(candidate.get(), shift, message));
            }
        }
        return Optional.empty();
    }

    private List<Alternative> findAlternatives(String resourceId, TimeInterval requested, ResolutionOptions options) {
        SchedulingProperties.Resolver settings = properties.getResolver();
        int duration = Intervals.duration(requested);
        int preferredHour = requested.startHour();
        int limit = options.maxAlternatives() > 0 ? options.maxAlternatives() : settings.getMaxAlternatives();

        List<Alternative> alternatives = new ArrayList<>();
        for (int offset = 1; offset <= settings.getHorizonDays(); offset++) {
            LocalDate day = requested.date().plusDays(offset);
            List<Slot> slots = slotStore.get(resourceId, day);
            List<TimeInterval> occupied = slots.stream()
                    .filter(slot -> slot.getStatus() != SlotStatus.AVAILABLE)
                    .filter(slot -> options.excludeBookingId() == null
                            || !options.excludeBookingId().equals(slot.getBookingRef()))
                    .map(Intervals::ofSlot)
                    .toList();

            for (Slot slot : slots) {
                if (slot.getStatus() != SlotStatus.AVAILABLE) {
                    continue;
                }
                TimeInterval slotInterval = Intervals.ofSlot(slot);
                if (Intervals.duration(slotInterval) < duration
                        || occupied.stream().anyMatch(busy -> Intervals.overlaps(busy, slotInterval))) {
                    continue;
                }
                int hourDiff = Math.abs(preferredHour - slotInterval.startHour());
                int score = scorer.score(slotInterval) - settings.getProximityPenaltyPerHour() * hourDiff;
                if (Intervals.duration(slotInterval) == duration) {
                    score += settings.getExactDurationBonus();
                }
                TimeInterval proposed = Intervals.startingAt(day, slot.getStartMinute(), duration);
                alternatives.add(new Alternative(day, proposed, score, describe(hourDiff)));
            }
        }
        return alternatives.stream()
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    private String describeTime(TimeInterval candidate, int score) {
        if (score > 80) {
            return "Optimal time with high demand";
        }
        if (score > 60) {
            return "Good available time";
        }
        return scorer.isLowValueHour(candidate.startHour()) ? "Quieter time with lower demand" : "Available time";
    }

    private static String describe(int hourDiff) {
        if (hourDiff == 0) {
            return "Same time on a different day";
        }
        return hourDiff <= 1 ? "Similar time on a different day" : "Alternative time on a different day";
    }
}
