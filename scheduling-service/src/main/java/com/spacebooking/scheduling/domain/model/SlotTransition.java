package com.spacebooking.scheduling.domain.model;

import com.spacebooking.common.exception.BusinessException;

/**
 * A requested status change together with the fields that accompany the target status.
 * Allowed: AVAILABLE to BUSY or BLOCKED and back, anything to MAINTENANCE, MAINTENANCE to AVAILABLE.
 */
public record SlotTransition(SlotStatus target, String bookingRef, String blockedReason, String blockedBy) {

    public static SlotTransition toBusy(String bookingRef) {
        return new SlotTransition(SlotStatus.BUSY, bookingRef, null, null);
    }

    public static SlotTransition toAvailable() {
        return new SlotTransition(SlotStatus.AVAILABLE, null, null, null);
    }

    public static SlotTransition toBlocked(String reason, String blockedBy) {
        return new SlotTransition(SlotStatus.BLOCKED, null, reason, blockedBy);
    }

    public static SlotTransition toMaintenance() {
        return new SlotTransition(SlotStatus.MAINTENANCE, null, null, null);
    }

    public boolean isAllowedFrom(SlotStatus current) {
        return switch (target) {
            case MAINTENANCE -> true;
            case BUSY, BLOCKED -> current == SlotStatus.AVAILABLE;
            case AVAILABLE -> current != SlotStatus.AVAILABLE;
        };
    }

    public void requireAllowedFrom(SlotStatus current) {
        if (!isAllowedFrom(current)) {
            throw new BusinessException(
                    String.format("Slot cannot move from %s to %s", current, target),
                    "ILLEGAL_SLOT_TRANSITION");
        }
    }

    /**
     * Writes the target status and its companion fields onto {@code slot}, clearing the ones that no longer apply.
     */
    public void applyTo(Slot slot) {
        slot.setStatus(target);
        slot.setBookingRef(target == SlotStatus.BUSY ? bookingRef : null);
        slot.setBlockedReason(target == SlotStatus.BLOCKED ? blockedReason : null);
        slot.setBlockedBy(target == SlotStatus.BLOCKED ? blockedBy : null);
    }
}
