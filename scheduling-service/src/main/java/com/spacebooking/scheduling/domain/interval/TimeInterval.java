package com.spacebooking.scheduling.domain.interval;

import com.spacebooking.scheduling.exception.InvalidIntervalException;

import java.time.LocalDate;

/**
 * Half-open interval {@code [startMinute, endMinute)} on a single calendar day.
 * Minutes count from local midnight of {@code date}; an interval never spans midnight.
 */
public record TimeInterval(LocalDate date, int startMinute, int endMinute) {

    public static final int LAST_MINUTE = 1439;

    public TimeInterval {
        if (date == null) {
            throw new InvalidIntervalException("Interval date is required");
        }
        if (startMinute < 0 || endMinute > LAST_MINUTE) {
            throw new InvalidIntervalException(String.format(
                    "Interval %d-%d lies outside the day (0-%d)", startMinute, endMinute, LAST_MINUTE));
        }
        if (startMinute >= endMinute) {
            throw new InvalidIntervalException(String.format(
                    "Interval start %d must be before end %d", startMinute, endMinute));
        }
    }

    public static TimeInterval of(LocalDate date, String startTime, String endTime) {
        return new TimeInterval(date, Intervals.toMinutes(startTime), Intervals.toMinutes(endTime));
    }

    public int startHour() {
        return startMinute / 60;
    }

    @Override
    public String toString() {
        return date + " " + Intervals.formatMinutes(startMinute) + "-" + Intervals.formatMinutes(endMinute);
    }
}
