package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * Commit or release of an interval on behalf of a booking.
 */
public record SlotCommitRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotBlank(message = "Start time cannot be blank")
        String startTime,

        @NotBlank(message = "End time cannot be blank")
        String endTime,

        @NotBlank(message = "Booking ID cannot be blank")
        String bookingId
) {
    public TimeInterval toInterval() {
        return TimeInterval.of(date, startTime, endTime);
    }
}
