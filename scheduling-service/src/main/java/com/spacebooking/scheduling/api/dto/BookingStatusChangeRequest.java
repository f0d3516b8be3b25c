package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.BookingStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record BookingStatusChangeRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotBlank(message = "Start time cannot be blank")
        String startTime,

        @NotBlank(message = "End time cannot be blank")
        String endTime,

        @NotBlank(message = "Booking ID cannot be blank")
        String bookingId,

        @NotNull(message = "Status cannot be null")
        BookingStatus status
) {
    public TimeInterval toInterval() {
        return TimeInterval.of(date, startTime, endTime);
    }
}
