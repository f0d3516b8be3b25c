package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.config.SchedulingProperties;
import com.spacebooking.scheduling.domain.model.BookingPolicy;
import com.spacebooking.scheduling.domain.model.PolicyType;
import com.spacebooking.scheduling.domain.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Policies declared under {@code scheduling.policies} in application.yml.
 */
@Slf4j
@Component
public class ConfiguredBookingPolicyProvider implements BookingPolicyProvider {

    private final List<BookingPolicy> policies;

    public ConfiguredBookingPolicyProvider(SchedulingProperties properties) {
        this.policies = properties.getPolicies().stream()
                .map(ConfiguredBookingPolicyProvider::toPolicy)
                .toList();
        log.info("Loaded {} booking policies from configuration", policies.size());
    }

    @Override
    public List<BookingPolicy> getPolicies() {
        return policies;
    }

    private static BookingPolicy toPolicy(SchedulingProperties.PolicyDefinition definition) {
        return BookingPolicy.builder()
                .name(definition.getName())
                .type(PolicyType.valueOf(definition.getType().trim().toUpperCase(Locale.ROOT)))
                .priority(definition.getPriority())
                .active(definition.isActive())
                .resourceType(definition.getResourceType() == null
                        ? null : ResourceType.fromValue(definition.getResourceType()))
                .resourceId(definition.getResourceId())
                .userRole(definition.getUserRole())
                .membershipLevel(definition.getMembershipLevel())
                .minDurationHours(definition.getMinDurationHours())
                .maxDurationHours(definition.getMaxDurationHours())
                .minAdvanceHours(definition.getMinAdvanceHours())
                .maxAdvanceDays(definition.getMaxAdvanceDays())
                .maxBookingsPerDay(definition.getMaxBookingsPerDay())
                .maxBookingsPerWeek(definition.getMaxBookingsPerWeek())
                .maxBookingsPerMonth(definition.getMaxBookingsPerMonth())
                .effectiveFrom(definition.getEffectiveFrom())
                .effectiveUntil(definition.getEffectiveUntil())
                .allowedDays(definition.getAllowedDays())
                .allowedStartTime(definition.getAllowedStartTime())
                .allowedEndTime(definition.getAllowedEndTime())
                .blockWeekends(definition.isBlockWeekends())
                .build();
    }
}
