package com.spacebooking.scheduling.domain.model;

/**
 * @param maxAlternatives  upper bound on date-shift proposals; values below 1 fall back to the configured default
 * @param excludeBookingId slots held by this booking are ignored (rescheduling an existing booking)
 */
public record ResolutionOptions(boolean allowTimeShift, boolean allowDateShift, int maxAlternatives,
                                String excludeBookingId) {

    public static ResolutionOptions defaults() {
        return new ResolutionOptions(true, true, 0, null);
    }
}
