package com.spacebooking.scheduling.domain.model;

import com.spacebooking.scheduling.domain.interval.TimeInterval;

public record Conflict(Long slotId, TimeInterval interval, ConflictType type, ConflictSeverity severity, String reason) {
}
