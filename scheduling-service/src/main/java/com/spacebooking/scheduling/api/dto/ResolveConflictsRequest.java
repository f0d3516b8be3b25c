package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.ResolutionOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

/**
 * Shift flags default to true; {@code maxAlternatives} defaults to the configured limit.
 */
public record ResolveConflictsRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

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
    public TimeInterval toInterval() {
        return TimeInterval.of(date, startTime, endTime);
    }

    public ResolutionOptions toOptions() {
        return new ResolutionOptions(
                allowTimeShift == null || allowTimeShift,
                allowDateShift == null || allowDateShift,
                maxAlternatives == null ? 0 : maxAlternatives,
                excludeBookingId);
    }
}
