package com.spacebooking.scheduling.domain.model;

import com.spacebooking.common.exception.BusinessException;

/**
 * Shape of generated supply. All values in minutes except {@code maxSlotsPerDay}.
 */
public record SlotGenerationOptions(int slotDurationMinutes, int breakMinutes, int maxSlotsPerDay) {

    public SlotGenerationOptions {
        if (slotDurationMinutes <= 0) {
            throw new BusinessException("Slot duration must be positive", "INVALID_GENERATION_OPTIONS");
        }
        if (breakMinutes < 0) {
            throw new BusinessException("Break duration cannot be negative", "INVALID_GENERATION_OPTIONS");
        }
        if (maxSlotsPerDay <= 0) {
            throw new BusinessException("Max slots per day must be positive", "INVALID_GENERATION_OPTIONS");
        }
    }

    public static SlotGenerationOptions defaults() {
        return new SlotGenerationOptions(60, 15, 12);
    }
}
