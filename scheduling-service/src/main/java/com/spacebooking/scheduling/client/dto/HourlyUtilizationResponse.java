package com.spacebooking.scheduling.client.dto;

import java.util.Map;

public record HourlyUtilizationResponse(String resourceId, Map<Integer, Double> hourly) {
}
