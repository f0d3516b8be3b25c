package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.model.CountWindow;

import java.time.LocalDate;

public interface BookingCountProvider {

    /**
     * Non-cancelled bookings of {@code userId} in the day, week or month containing {@code anchorDate}.
     *
     * @param resourceId narrows the count to one resource; null counts across all resources
     */
    long countBookings(String userId, String resourceId, CountWindow window, LocalDate anchorDate);
}
