package com.spacebooking.scheduling.domain.model;

public enum CountWindow {
    DAY,
    WEEK,
    MONTH
}
