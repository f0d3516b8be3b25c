package com.spacebooking.scheduling.domain.model;

public enum SlotStatus {
    AVAILABLE,
    BUSY,
    BLOCKED,
    MAINTENANCE
}
