package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.model.BookingPolicy;

import java.util.List;

public interface BookingPolicyProvider {

    /**
     * Every known policy, active or not; selection happens in {@code ApplicablePolicies.select}.
     */
    List<BookingPolicy> getPolicies();
}
