package com.spacebooking.scheduling.domain.model;

import java.util.List;

/**
 * Outcome of policy validation. On rejection, {@code reason}, {@code reasonCode} and {@code policyName}
 * identify the first failing check of the highest-priority failing policy.
 */
public record PolicyDecision(boolean allowed, String reason, String reasonCode, String policyName,
                             List<String> appliedPolicies) {

    public PolicyDecision {
        appliedPolicies = appliedPolicies == null ? List.of() : List.copyOf(appliedPolicies);
    }

    public static PolicyDecision allowed(List<String> appliedPolicies) {
        return new PolicyDecision(true, null, null, null, appliedPolicies);
    }

    public static PolicyDecision rejected(String reason, String reasonCode, String policyName,
                                          List<String> appliedPolicies) {
        return new PolicyDecision(false, reason, reasonCode, policyName, appliedPolicies);
    }
}
