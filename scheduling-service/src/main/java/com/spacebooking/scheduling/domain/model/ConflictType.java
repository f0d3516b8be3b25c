package com.spacebooking.scheduling.domain.model;

public enum ConflictType {
    BUSY,
    BLOCKED,
    MAINTENANCE
}
