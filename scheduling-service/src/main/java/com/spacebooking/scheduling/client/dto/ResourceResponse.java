package com.spacebooking.scheduling.client.dto;

public record ResourceResponse(String id, String name, String type) {
}
