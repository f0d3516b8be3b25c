package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * {@code reason} and {@code blockedBy} are ignored when unblocking.
 */
public record BlockSlotsRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotBlank(message = "Start time cannot be blank")
        String startTime,

        @NotBlank(message = "End time cannot be blank")
        String endTime,

        String reason,

        String blockedBy
) {
    public TimeInterval toInterval() {
        return TimeInterval.of(date, startTime, endTime);
    }
}
