package com.spacebooking.scheduling.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative booking rule. Every limit is optional; a null limit is not checked.
 * {@code allowedDays} uses 0 = Sunday .. 6 = Saturday.
 */
@Builder(toBuilder = true)
public record BookingPolicy(
        String name,
        PolicyType type,
        int priority,
        boolean active,
        ResourceType resourceType,
        String resourceId,
        String userRole,
        String membershipLevel,
        BigDecimal minDurationHours,
        BigDecimal maxDurationHours,
        BigDecimal minAdvanceHours,
        Integer maxAdvanceDays,
        Integer maxBookingsPerDay,
        Integer maxBookingsPerWeek,
        Integer maxBookingsPerMonth,
        LocalDate effectiveFrom,
        LocalDate effectiveUntil,
        Set<Integer> allowedDays,
        LocalTime allowedStartTime,
        LocalTime allowedEndTime,
        boolean blockWeekends) {

    public BookingPolicy {
        allowedDays = allowedDays == null ? Set.of() : Set.copyOf(allowedDays);
    }

    boolean isEffectiveAt(LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        if (effectiveFrom != null && effectiveFrom.isAfter(today)) {
            return false;
        }
        return effectiveUntil == null || !effectiveUntil.isBefore(today);
    }

    boolean appliesTo(BookingCandidate candidate) {
        if (type == null) {
            return false;
        }
        return switch (type) {
            case GLOBAL -> true;
            case RESOURCE_TYPE -> resourceType != null && resourceType == candidate.resourceType();
            case RESOURCE_SPECIFIC -> resourceId != null && resourceId.equals(candidate.resourceId());
            case USER_ROLE -> userRole != null && userRole.equalsIgnoreCase(Objects.toString(candidate.userRole(), ""));
            case MEMBERSHIP_LEVEL -> membershipLevel != null
                    && membershipLevel.equalsIgnoreCase(Objects.toString(candidate.membershipLevel(), ""));
        };
    }

    public boolean hasCountCaps() {
        return maxBookingsPerDay != null || maxBookingsPerWeek != null || maxBookingsPerMonth != null;
    }
}
