package com.spacebooking.scheduling.domain.model;

public enum PolicyType {
    GLOBAL,
    RESOURCE_TYPE,
    RESOURCE_SPECIFIC,
    USER_ROLE,
    MEMBERSHIP_LEVEL
}
