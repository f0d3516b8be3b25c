package com.spacebooking.scheduling.domain.service;

import java.time.LocalDate;
import java.util.Map;

public interface UsageStatsProvider {

    /**
     * Historical utilization per start hour (0-23) over {@code [from, to]}, each value in 0.0-1.0.
     */
    Map<Integer, Double> getHourlyUtilization(String resourceId, LocalDate from, LocalDate to);
}
