package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.model.AdmissionResult;
import com.spacebooking.scheduling.domain.model.ApplicablePolicies;
import com.spacebooking.scheduling.domain.model.BookingCandidate;
import com.spacebooking.scheduling.domain.model.ConflictReport;
import com.spacebooking.scheduling.domain.model.PolicyDecision;
import com.spacebooking.scheduling.domain.model.ResolutionOptions;
import com.spacebooking.scheduling.domain.model.ResolutionOutcome;
import com.spacebooking.scheduling.domain.model.ResourceType;
import com.spacebooking.scheduling.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Admission pipeline for a new booking request: policies, then conflicts, then resolution.
 * A policy rejection ends the pipeline before any slot is read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingAdmissionService {

    private final BookingPolicyProvider policyProvider;
    private final BookingPolicyValidator policyValidator;
    private final ConflictDetector conflictDetector;
    private final ConflictResolver conflictResolver;
    private final ResourceMetadataProvider metadataProvider;
    private final Clock clock;

    public AdmissionResult admit(BookingCandidate candidate, ResolutionOptions options) {
        BookingCandidate typed = withResourceType(candidate);
        ApplicablePolicies policies = ApplicablePolicies.select(
                policyProvider.getPolicies(), typed, LocalDateTime.now(clock));

        PolicyDecision decision = policyValidator.validate(typed, policies);
        if (!decision.allowed()) {
            return AdmissionResult.rejected(decision);
        }

        ConflictReport report = conflictDetector.checkConflicts(typed.resourceId(), typed.interval().date(),
                typed.interval(), options.excludeBookingId());
        if (report.canProceed()) {
            return AdmissionResult.acceptable(decision, report);
        }

        ResolutionOutcome resolution = conflictResolver.resolveConflicts(typed.resourceId(), typed.interval().date(),
                typed.interval(), options);
        log.debug("Booking request for resource {} at {} conflicts; resolution: {}",
                typed.resourceId(), typed.interval(), resolution.getClass().getSimpleName());
        return AdmissionResult.conflict(decision, report, resolution);
    }

    /**
     * Validates policies only, resolving the resource type first when the caller did not supply it.
     */
    public PolicyDecision validatePolicies(BookingCandidate candidate) {
        BookingCandidate typed = withResourceType(candidate);
        ApplicablePolicies policies = ApplicablePolicies.select(
                policyProvider.getPolicies(), typed, LocalDateTime.now(clock));
        return policyValidator.validate(typed, policies);
    }

    private BookingCandidate withResourceType(BookingCandidate candidate) {
        if (candidate.resourceType() != null) {
            return candidate;
        }
        try {
            return candidate.withResourceType(metadataProvider.getResourceType(candidate.resourceId()));
        } catch (UpstreamUnavailableException e) {
            log.warn("Resource type unavailable for {}; type-specific policies will not apply", candidate.resourceId());
            return candidate.withResourceType(ResourceType.OTHER);
        }
    }
}
