package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.model.SlotGenerationOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

public record GenerateSlotsRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        @Positive(message = "Slot duration must be positive")
        Integer slotDurationMinutes,

        @PositiveOrZero(message = "Break duration cannot be negative")
        Integer breakMinutes,

        @Positive(message = "Max slots per day must be positive")
        Integer maxSlotsPerDay
) {
    /**
     * Missing values are taken from {@code defaults}.
     */
    public SlotGenerationOptions toOptions(SlotGenerationOptions defaults) {
        return new SlotGenerationOptions(
                slotDurationMinutes != null ? slotDurationMinutes : defaults.slotDurationMinutes(),
                breakMinutes != null ? breakMinutes : defaults.breakMinutes(),
                maxSlotsPerDay != null ? maxSlotsPerDay : defaults.maxSlotsPerDay());
    }
}
