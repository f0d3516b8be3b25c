package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.BookingCandidate;
import com.spacebooking.scheduling.domain.model.ResolutionOptions;
import com.spacebooking.scheduling.domain.model.ResourceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

/**
 * Booking request as submitted for policy validation or admission.
 * {@code resourceType} is looked up from the resource catalogue when omitted.
 */
public record BookingRequest(
        @NotBlank(message = "User ID cannot be blank")
        String userId,

        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        String resourceType,

        String userRole,

        String membershipLevel,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotBlank(message = "Start time cannot be blank")
        String startTime,

        @NotBlank(message = "End time cannot be blank")
        String endTime,

        Boolean allowTimeShift,

        Boolean allowDateShift,

        @PositiveOrZero(message = "Max alternatives cannot be negative")
        Integer maxAlternatives,

        String excludeBookingId
) {
    public BookingCandidate toCandidate() {
        return new BookingCandidate(userId, resourceId,
                resourceType == null ? null : ResourceType.fromValue(resourceType),
                userRole, membershipLevel, TimeInterval.of(date, startTime, endTime));
    }

    public ResolutionOptions toOptions() {
        return new ResolutionOptions(
                allowTimeShift == null || allowTimeShift,
                allowDateShift == null || allowDateShift,
                maxAlternatives == null ? 0 : maxAlternatives,
                excludeBookingId);
    }
}
