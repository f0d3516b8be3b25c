package com.spacebooking.scheduling.domain.model;

public enum RecurringFrequency {
    DAILY,
    WEEKLY,
    MONTHLY
}
