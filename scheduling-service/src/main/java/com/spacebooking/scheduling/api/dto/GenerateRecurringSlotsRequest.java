package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.RecurringFrequency;
import com.spacebooking.scheduling.domain.model.RecurringPattern;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.Set;

public record GenerateRecurringSlotsRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        @NotBlank(message = "Start time cannot be blank")
        String startTime,

        @NotBlank(message = "End time cannot be blank")
        String endTime,

        @NotNull(message = "Frequency cannot be null")
        RecurringFrequency frequency,

        @Positive(message = "Interval must be positive")
        Integer interval,

        Set<Integer> daysOfWeek
) {
    public TimeInterval toDailyWindow() {
        return TimeInterval.of(startDate, startTime, endTime);
    }

    public RecurringPattern toPattern() {
        return new RecurringPattern(frequency, interval == null ? 1 : interval, daysOfWeek);
    }
}
