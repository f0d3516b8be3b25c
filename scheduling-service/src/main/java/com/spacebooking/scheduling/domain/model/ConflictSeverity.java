package com.spacebooking.scheduling.domain.model;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH
}
