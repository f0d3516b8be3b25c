package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.model.OptimizationOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

public record OptimizeSlotsRequest(
        @NotBlank(message = "Resource ID cannot be blank")
        String resourceId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        Boolean useDemandSignal,

        Boolean consolidate,

        @Positive(message = "Max slots per day must be positive")
        Integer maxSlotsPerDay
) {
    public OptimizationOptions toOptions() {
        return new OptimizationOptions(
                useDemandSignal == null || useDemandSignal,
                consolidate == null || consolidate,
                maxSlotsPerDay);
    }
}
