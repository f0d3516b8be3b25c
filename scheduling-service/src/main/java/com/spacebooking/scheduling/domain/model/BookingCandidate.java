package com.spacebooking.scheduling.domain.model;

import com.spacebooking.scheduling.domain.interval.TimeInterval;

/**
 * A booking request as seen by the policy validator.
 */
public record BookingCandidate(String userId, String resourceId, ResourceType resourceType, String userRole,
                               String membershipLevel, TimeInterval interval) {

    public BookingCandidate withResourceType(ResourceType type) {
        return new BookingCandidate(userId, resourceId, type, userRole, membershipLevel, interval);
    }
}
