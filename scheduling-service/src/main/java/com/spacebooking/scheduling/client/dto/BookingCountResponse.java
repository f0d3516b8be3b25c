package com.spacebooking.scheduling.client.dto;

public record BookingCountResponse(long count) {
}
