package com.spacebooking.scheduling.domain.service;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.OperatingHours;
import com.spacebooking.scheduling.domain.model.RecurringPattern;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotGenerationOptions;
import com.spacebooking.scheduling.domain.model.SlotStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Plans slot supply. Pure: produces unsaved AVAILABLE slots and never reads or writes the store.
 */
@Component
public class SlotGenerator {

    /**
     * Lays out {@code slotDuration} blocks separated by {@code break} from each day's opening minute,
     * the last block ending at or before closing, at most {@code maxSlotsPerDay} per day.
     * Days for which {@code hoursForDay} is empty are closed.
     */
    public List<Slot> generate(String resourceId, LocalDate startDate, LocalDate endDate,
                               Function<LocalDate, Optional<OperatingHours>> hoursForDay,
                               SlotGenerationOptions options) {
        requireRange(startDate, endDate);
        List<Slot> planned = new ArrayList<>();
        for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(1)) {
            Optional<OperatingHours> hours = hoursForDay.apply(day);
            if (hours.isEmpty()) {
                continue;
            }
            int close = Math.min(hours.get().closeMinute(), TimeInterval.LAST_MINUTE);
            int start = hours.get().openMinute();
            int count = 0;
            while (start + options.slotDurationMinutes() <= close && count < options.maxSlotsPerDay()) {
                planned.add(newSlot(resourceId, day, start, start + options.slotDurationMinutes(), null));
                start += options.slotDurationMinutes() + options.breakMinutes();
                count++;
            }
        }
        return planned;
    }

    /**
     * One slot {@code [startMinute, endMinute)} per occurrence of {@code pattern} in {@code [startDate, endDate]}.
     * Weekly patterns count weeks from the Sunday-started week containing {@code startDate}.
     */
    public List<Slot> generateRecurring(String resourceId, LocalDate startDate, LocalDate endDate,
                                        int startMinute, int endMinute, RecurringPattern pattern) {
        requireRange(startDate, endDate);
        new TimeInterval(startDate, startMinute, endMinute);

        List<Slot> planned = new ArrayList<>();
        for (LocalDate day : occurrences(startDate, endDate, pattern)) {
            planned.add(newSlot(resourceId, day, startMinute, endMinute, pattern));
        }
        return planned;
    }

    private List<LocalDate> occurrences(LocalDate startDate, LocalDate endDate, RecurringPattern pattern) {
        List<LocalDate> days = new ArrayList<>();
        int interval = pattern.interval();
        switch (pattern.frequency()) {
            case DAILY -> {
                for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(interval)) {
                    days.add(day);
                }
            }
            case WEEKLY -> {
                if (pattern.daysOfWeek().isEmpty()) {
                    for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusWeeks(interval)) {
                        days.add(day);
                    }
                } else {
                    LocalDate firstWeek = weekStart(startDate);
                    for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(1)) {
                        long weekIndex = ChronoUnit.WEEKS.between(firstWeek, weekStart(day));
                        if (weekIndex % interval == 0 && pattern.daysOfWeek().contains(dayIndex(day))) {
                            days.add(day);
                        }
                    }
                }
            }
            case MONTHLY -> {
                for (int step = 0; ; step++) {
                    LocalDate day = startDate.plusMonths((long) step * interval);
                    if (day.isAfter(endDate)) {
                        break;
                    }
                    days.add(day);
                }
            }
        }
        return days;
    }

    private static LocalDate weekStart(LocalDate day) {
        return day.minusDays(dayIndex(day));
    }

    /**
     * 0 = Sunday .. 6 = Saturday.
     */
    static int dayIndex(LocalDate day) {
        return day.getDayOfWeek().getValue() % 7;
    }

    private static Slot newSlot(String resourceId, LocalDate day, int start, int end, RecurringPattern pattern) {
        return Slot.builder()
                .resourceId(resourceId)
                .slotDate(day)
                .startMinute(start)
                .endMinute(end)
                .status(SlotStatus.AVAILABLE)
                .recurring(pattern)
                .build();
    }

    private static void requireRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            throw new BusinessException("Invalid date range: " + startDate + " to " + endDate, "INVALID_DATE_RANGE");
        }
    }
}
