package com.spacebooking.scheduling.domain.model;

/**
 * Lifecycle of a booking owned by the booking service. Only a cancelled booking stops
 * occupying its interval; completed and no-show bookings keep it for history and statistics.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED,
    NO_SHOW;

    public boolean occupiesInterval() {
        return this != CANCELLED;
    }
}
