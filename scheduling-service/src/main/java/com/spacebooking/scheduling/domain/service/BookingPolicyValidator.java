package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.ApplicablePolicies;
import com.spacebooking.scheduling.domain.model.BookingCandidate;
import com.spacebooking.scheduling.domain.model.BookingPolicy;
import com.spacebooking.scheduling.domain.model.CountWindow;
import com.spacebooking.scheduling.domain.model.PolicyDecision;
import com.spacebooking.scheduling.domain.model.PolicyType;
import com.spacebooking.scheduling.exception.PolicyViolationException;
import com.spacebooking.scheduling.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a booking candidate against the applicable policies, highest priority first.
 * <p>
 * Per policy the checks run in a fixed order: duration, advance notice, weekend/day/time-of-day windows,
 * then booking-count caps. The first failing check ends validation.
 * Count caps need the booking service; when it cannot answer, validation fails instead of allowing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingPolicyValidator {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final BookingCountProvider bookingCountProvider;
    private final Clock clock;

    public PolicyDecision validate(BookingCandidate candidate, ApplicablePolicies policies) {
        List<String> applied = policies.policies().stream().map(BookingPolicy::name).toList();
        LocalDateTime now = LocalDateTime.now(clock);
        Map<CountKey, Long> counts = new HashMap<>();

        for (BookingPolicy policy : policies.policies()) {
            Optional<Violation> violation = firstViolation(policy, candidate, now, counts);
            if (violation.isPresent()) {
                log.info("Booking of resource {} by user {} rejected by policy '{}': {}",
                        candidate.resourceId(), candidate.userId(), policy.name(), violation.get().reason());
                return PolicyDecision.rejected(violation.get().reason(), violation.get().code(), policy.name(), applied);
            }
        }
        return PolicyDecision.allowed(applied);
    }

    public PolicyDecision validateOrThrow(BookingCandidate candidate, ApplicablePolicies policies) {
        PolicyDecision decision = validate(candidate, policies);
        if (!decision.allowed()) {
            throw new PolicyViolationException(decision);
        }
        return decision;
    }

    private Optional<Violation> firstViolation(BookingPolicy policy, BookingCandidate candidate, LocalDateTime now,
                                               Map<CountKey, Long> counts) {
        TimeInterval interval = candidate.interval();
        BigDecimal durationMinutes = BigDecimal.valueOf(Intervals.duration(interval));

        if (policy.minDurationHours() != null
                && durationMinutes.compareTo(policy.minDurationHours().multiply(MINUTES_PER_HOUR)) < 0) {
            return violation("MIN_DURATION",
                    "Minimum booking duration is " + hours(policy.minDurationHours()) + " hours");
        }
        if (policy.maxDurationHours() != null
                && durationMinutes.compareTo(policy.maxDurationHours().multiply(MINUTES_PER_HOUR)) > 0) {
            return violation("MAX_DURATION",
                    "Maximum booking duration is " + hours(policy.maxDurationHours()) + " hours");
        }

        LocalDateTime start = interval.date().atStartOfDay().plusMinutes(interval.startMinute());
        long advanceMinutes = Duration.between(now, start).toMinutes();
        if (policy.minAdvanceHours() != null
                && BigDecimal.valueOf(advanceMinutes).compareTo(policy.minAdvanceHours().multiply(MINUTES_PER_HOUR)) < 0) {
            return violation("MIN_ADVANCE",
                    "Bookings must be made at least " + hours(policy.minAdvanceHours()) + " hours in advance");
        }
        if (policy.maxAdvanceDays() != null && advanceMinutes > policy.maxAdvanceDays() * 24L * 60L) {
            return violation("MAX_ADVANCE",
                    "Bookings cannot be made more than " + policy.maxAdvanceDays() + " days in advance");
        }

        DayOfWeek dayOfWeek = interval.date().getDayOfWeek();
        if (policy.blockWeekends() && (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY)) {
            return violation("WEEKEND_BLOCKED", "Bookings are not allowed on weekends");
        }
        if (!policy.allowedDays().isEmpty() && !policy.allowedDays().contains(dayOfWeek.getValue() % 7)) {
            return violation("DAY_NOT_ALLOWED", "Bookings are not allowed on " + dayOfWeek);
        }
        if (outsideAllowedHours(policy, interval)) {
            return violation("OUTSIDE_ALLOWED_HOURS", String.format("Bookings are only allowed between %s and %s",
                    policy.allowedStartTime() != null ? policy.allowedStartTime() : LocalTime.MIN,
                    policy.allowedEndTime() != null ? policy.allowedEndTime() : LocalTime.MAX.withNano(0)));
        }

        if (!policy.hasCountCaps()) {
            return Optional.empty();
        }
        String scope = policy.type() == PolicyType.RESOURCE_SPECIFIC ? candidate.resourceId() : null;
        if (exceeds(policy, policy.maxBookingsPerDay(), candidate, scope, CountWindow.DAY, counts)) {
            return violation("DAILY_LIMIT", "Daily booking limit of " + policy.maxBookingsPerDay() + " reached");
        }
        if (exceeds(policy, policy.maxBookingsPerWeek(), candidate, scope, CountWindow.WEEK, counts)) {
            return violation("WEEKLY_LIMIT", "Weekly booking limit of " + policy.maxBookingsPerWeek() + " reached");
        }
        if (exceeds(policy, policy.maxBookingsPerMonth(), candidate, scope, CountWindow.MONTH, counts)) {
            return violation("MONTHLY_LIMIT", "Monthly booking limit of " + policy.maxBookingsPerMonth() + " reached");
        }
        return Optional.empty();
    }

    private boolean outsideAllowedHours(BookingPolicy policy, TimeInterval interval) {
        if (policy.allowedStartTime() != null
                && interval.startMinute() < policy.allowedStartTime().toSecondOfDay() / 60) {
            return true;
        }
        return policy.allowedEndTime() != null
                && interval.endMinute() > policy.allowedEndTime().toSecondOfDay() / 60;
    }

    private boolean exceeds(BookingPolicy policy, Integer cap, BookingCandidate candidate, String scope,
                            CountWindow window, Map<CountKey, Long> counts) {
        if (cap == null) {
            return false;
        }
        long count = counts.computeIfAbsent(new CountKey(scope, window),
                key -> fetchCount(policy, candidate, scope, window));
        return count >= cap;
    }

    private long fetchCount(BookingPolicy policy, BookingCandidate candidate, String scope, CountWindow window) {
        try {
            return bookingCountProvider.countBookings(candidate.userId(), scope, window, candidate.interval().date());
        } catch (UpstreamUnavailableException e) {
            log.warn("Booking counts unavailable while enforcing policy '{}' for user {}",
                    policy.name(), candidate.userId());
            throw new UpstreamUnavailableException(
                    "Booking counts unavailable; cannot enforce policy '" + policy.name() + "'",
                    e, "BOOKING_COUNT_UNAVAILABLE");
        }
    }

    private static Optional<Violation> violation(String code, String reason) {
        return Optional.of(new Violation(code, reason));
    }

    private static String hours(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private record Violation(String code, String reason) {
    }

    private record CountKey(String scope, CountWindow window) {
    }
}
