package com.spacebooking.scheduling.domain.model;

/**
 * Combined verdict of policy validation, conflict detection and, when needed, resolution.
 * {@code conflictReport} is null when policies rejected the request; {@code resolution} is null
 * unless the request conflicted.
 */
public record AdmissionResult(Verdict verdict, PolicyDecision policyDecision, ConflictReport conflictReport,
                              ResolutionOutcome resolution) {

    public enum Verdict {
        ACCEPTABLE,
        REJECTED,
        CONFLICT
    }

    public static AdmissionResult rejected(PolicyDecision decision) {
        return new AdmissionResult(Verdict.REJECTED, decision, null, null);
    }

    public static AdmissionResult acceptable(PolicyDecision decision, ConflictReport report) {
        return new AdmissionResult(Verdict.ACCEPTABLE, decision, report, null);
    }

    public static AdmissionResult conflict(PolicyDecision decision, ConflictReport report,
                                           ResolutionOutcome resolution) {
        return new AdmissionResult(Verdict.CONFLICT, decision, report, resolution);
    }
}
