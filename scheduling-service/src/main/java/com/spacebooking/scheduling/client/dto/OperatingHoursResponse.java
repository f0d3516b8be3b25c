package com.spacebooking.scheduling.client.dto;

/**
 * Opening window of a resource on one weekday, {@code HH:mm} times. {@code closed} wins over the times.
 */
public record OperatingHoursResponse(String open, String close, boolean closed) {
}
