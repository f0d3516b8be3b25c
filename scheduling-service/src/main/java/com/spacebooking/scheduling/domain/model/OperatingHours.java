package com.spacebooking.scheduling.domain.model;

import com.spacebooking.common.util.Constants;
import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.exception.InvalidIntervalException;

/**
 * Opening window of a resource on one day, in minutes since midnight.
 */
public record OperatingHours(int openMinute, int closeMinute) {

    public OperatingHours {
        if (openMinute < 0 || closeMinute > Constants.MINUTES_PER_DAY || openMinute >= closeMinute) {
            throw new InvalidIntervalException(String.format(
                    "Invalid operating hours %d-%d", openMinute, closeMinute));
        }
    }

    public static OperatingHours of(String open, String close) {
        return new OperatingHours(Intervals.toMinutes(open), Intervals.toMinutes(close));
    }
}
