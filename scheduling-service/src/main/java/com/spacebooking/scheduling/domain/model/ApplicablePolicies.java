package com.spacebooking.scheduling.domain.model;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Policies that apply to one candidate at one instant, highest priority first.
 * Only {@link #select} creates instances, so holding one proves filtering and ordering were done.
 */
public final class ApplicablePolicies {

    private final List<BookingPolicy> policies;

    private ApplicablePolicies(List<BookingPolicy> policies) {
        this.policies = policies;
    }

    public static ApplicablePolicies select(Collection<BookingPolicy> all, BookingCandidate candidate,
                                            LocalDateTime now) {
        List<BookingPolicy> selected = all.stream()
                .filter(BookingPolicy::active)
                .filter(policy -> policy.isEffectiveAt(now))
                .filter(policy -> policy.appliesTo(candidate))
                .sorted(Comparator.comparingInt(BookingPolicy::priority).reversed())
                .toList();
        return new ApplicablePolicies(selected);
    }

    public List<BookingPolicy> policies() {
        return policies;
    }

    public boolean isEmpty() {
        return policies.isEmpty();
    }
}
