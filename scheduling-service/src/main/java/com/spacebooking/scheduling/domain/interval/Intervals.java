package com.spacebooking.scheduling.domain.interval;

import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.exception.InvalidIntervalException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interval algebra shared by every scheduling component.
 * All overlap and containment decisions in the engine go through this class.
 */
public final class Intervals {

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private Intervals() {
    }

    /**
     * Parses {@code HH:mm} into minutes since midnight. {@code 24:00} is accepted and maps to 1440
     * so that closing times can be expressed; intervals themselves still end at 1439 at most.
     */
    public static int toMinutes(String time) {
        if (time == null) {
            throw new InvalidIntervalException("Time is required");
        }
        Matcher matcher = TIME_PATTERN.matcher(time.trim());
        if (!matcher.matches()) {
            throw new InvalidIntervalException("Invalid time format, expected HH:mm: " + time);
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        if (minutes > 59 || hours > 24 || (hours == 24 && minutes > 0)) {
            throw new InvalidIntervalException("Invalid time of day: " + time);
        }
        return hours * 60 + minutes;
    }

    public static String formatMinutes(int minutes) {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    /**
     * Half-open overlap. Intervals on different days never overlap and touching endpoints do not conflict.
     */
    public static boolean overlaps(TimeInterval a, TimeInterval b) {
        return a.date().equals(b.date())
                && a.startMinute() < b.endMinute()
                && b.startMinute() < a.endMinute();
    }

    /**
     * Point containment, {@code start <= minute < end}.
     */
    public static boolean contains(TimeInterval interval, int minute) {
        return interval.startMinute() <= minute && minute < interval.endMinute();
    }

    public static int duration(TimeInterval interval) {
        return interval.endMinute() - interval.startMinute();
    }

    /**
     * Moves the interval by {@code minutes}; empty when the result would leave the day.
     */
    public static Optional<TimeInterval> shift(TimeInterval interval, int minutes) {
        int start = interval.startMinute() + minutes;
        int end = interval.endMinute() + minutes;
        if (start < 0 || end > TimeInterval.LAST_MINUTE) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(interval.date(), start, end));
    }

    public static TimeInterval ofSlot(Slot slot) {
        return new TimeInterval(slot.getSlotDate(), slot.getStartMinute(), slot.getEndMinute());
    }

    public static TimeInterval startingAt(LocalDate date, int startMinute, int durationMinutes) {
        return new TimeInterval(date, startMinute, startMinute + durationMinutes);
    }

    /**
     * Parts of {@code interval} not covered by any interval in {@code covering}, in ascending order.
     */
    public static List<TimeInterval> uncovered(TimeInterval interval, Collection<TimeInterval> covering) {
        List<TimeInterval> sorted = covering.stream()
                .filter(candidate -> overlaps(candidate, interval))
                .sorted(Comparator.comparingInt(TimeInterval::startMinute))
                .toList();

        List<TimeInterval> gaps = new ArrayList<>();
        int cursor = interval.startMinute();
        for (TimeInterval cover : sorted) {
            if (cover.startMinute() > cursor) {
                gaps.add(new TimeInterval(interval.date(), cursor, Math.min(cover.startMinute(), interval.endMinute())));
            }
            cursor = Math.max(cursor, cover.endMinute());
            if (cursor >= interval.endMinute()) {
                break;
            }
        }
        if (cursor < interval.endMinute()) {
            gaps.add(new TimeInterval(interval.date(), cursor, interval.endMinute()));
        }
        return gaps;
    }
}
