package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.interval.Intervals;
import com.spacebooking.scheduling.domain.model.RecurringPattern;
import com.spacebooking.scheduling.domain.model.Slot;
import com.spacebooking.scheduling.domain.model.SlotStatus;

import java.time.LocalDate;
import java.util.List;

public record SlotResponse(
        Long id,
        String resourceId,
        LocalDate date,
        String startTime,
        String endTime,
        SlotStatus status,
        String bookingRef,
        String blockedReason,
        String blockedBy,
        RecurringPattern recurring,
        Long version
) {
    public static SlotResponse from(Slot slot) {
        return new SlotResponse(
                slot.getId(),
                slot.getResourceId(),
                slot.getSlotDate(),
                Intervals.formatMinutes(slot.getStartMinute()),
                Intervals.formatMinutes(slot.getEndMinute()),
                slot.getStatus(),
                slot.getBookingRef(),
                slot.getBlockedReason(),
                slot.getBlockedBy(),
                slot.getRecurring(),
                slot.getVersion()
        );
    }

    public static List<SlotResponse> fromAll(List<Slot> slots) {
        return slots.stream().map(SlotResponse::from).toList();
    }
}
