package com.spacebooking.scheduling.domain.model;

import com.spacebooking.common.exception.BusinessException;

import java.util.Set;

/**
 * Repetition rule used when generating recurring slots.
 *
 * @param frequency  unit of repetition
 * @param interval   every n-th day, week or month; at least 1
 * @param daysOfWeek weekly only: 0 = Sunday .. 6 = Saturday; empty means the weekday of the start date
 */
public record RecurringPattern(RecurringFrequency frequency, int interval, Set<Integer> daysOfWeek) {

    public RecurringPattern {
        if (frequency == null) {
            throw new BusinessException("Recurring frequency is required", "INVALID_RECURRENCE");
        }
        if (interval < 1) {
            throw new BusinessException("Recurring interval must be at least 1", "INVALID_RECURRENCE");
        }
        daysOfWeek = daysOfWeek == null ? Set.of() : Set.copyOf(daysOfWeek);
        for (Integer day : daysOfWeek) {
            if (day < 0 || day > 6) {
                throw new BusinessException("Day of week must be between 0 (Sunday) and 6: " + day,
                        "INVALID_RECURRENCE");
            }
        }
    }
}
