package com.spacebooking.scheduling.domain.model;

import java.util.List;

/**
 * Summary of one optimization pass.
 *
 * @param efficiency optimized slot count as a percentage of the original count
 */
public record OptimizationResult(int originalSlots, int optimizedSlots, double efficiency,
                                 List<String> recommendations) {

    public OptimizationResult {
        recommendations = List.copyOf(recommendations);
    }
}
