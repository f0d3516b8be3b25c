package com.spacebooking.scheduling.domain.model;

/**
 * @param maxSlotsPerDay null leaves the number of slots per day unbounded
 */
public record OptimizationOptions(boolean useDemandSignal, boolean consolidate, Integer maxSlotsPerDay) {
}
