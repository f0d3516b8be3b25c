package com.spacebooking.scheduling.api.controller;

import com.spacebooking.common.dto.BaseResponse;
import com.spacebooking.scheduling.api.dto.BookingRequest;
import com.spacebooking.scheduling.api.dto.ConflictCheckRequest;
import com.spacebooking.scheduling.api.dto.ResolveConflictsRequest;
import com.spacebooking.scheduling.domain.interval.TimeInterval;
import com.spacebooking.scheduling.domain.model.AdmissionResult;
import com.spacebooking.scheduling.domain.model.Alternative;
import com.spacebooking.scheduling.domain.model.ConflictReport;
import com.spacebooking.scheduling.domain.model.PolicyDecision;
import com.spacebooking.scheduling.domain.model.ResolutionOutcome;
import com.spacebooking.scheduling.domain.service.BookingAdmissionService;
import com.spacebooking.scheduling.domain.service.ConflictDetector;
import com.spacebooking.scheduling.domain.service.ConflictResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-side scheduling decisions: conflicts, resolution proposals, free-time search, policies and combined
 * admission.
 * None of these endpoints change slots.
 */
@RestController
@RequestMapping("/api/v1/scheduling")
@RequiredArgsConstructor
public class SchedulingController {

    private final ConflictDetector conflictDetector;
    private final ConflictResolver conflictResolver;
    private final BookingAdmissionService admissionService;

    @PostMapping("/conflicts/check")
    public ResponseEntity<BaseResponse<ConflictReport>> checkConflicts(
            @Valid @RequestBody ConflictCheckRequest request) {
        ConflictReport report = conflictDetector.checkConflicts(
                request.resourceId(), request.date(), request.toInterval(), request.excludeBookingId());
        return ResponseEntity.ok(BaseResponse.success(report));
    }

    @PostMapping("/conflicts/resolve")
    public ResponseEntity<BaseResponse<ResolutionOutcome>> resolveConflicts(
            @Valid @RequestBody ResolveConflictsRequest request) {
        ResolutionOutcome outcome = conflictResolver.resolveConflicts(
                request.resourceId(), request.date(), request.toInterval(), request.toOptions());
        return ResponseEntity.ok(BaseResponse.success(outcome));
    }

    @GetMapping("/optimal-times/{resourceId}")
    public ResponseEntity<BaseResponse<List<Alternative>>> getOptimalTimes(
            @PathVariable String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam int durationMinutes,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {
        TimeInterval window = from != null && to != null ? TimeInterval.of(date, from, to) : null;
        List<Alternative> times = conflictResolver.findOptimalTimes(resourceId, date, durationMinutes, window);
        return ResponseEntity.ok(BaseResponse.success(times));
    }

    @PostMapping("/policies/validate")
    public ResponseEntity<BaseResponse<PolicyDecision>> validatePolicies(@Valid @RequestBody BookingRequest request) {
        PolicyDecision decision = admissionService.validatePolicies(request.toCandidate());
        if (!decision.allowed()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(BaseResponse.rejected(decision.reason(), decision.reasonCode(), decision));
        }
        return ResponseEntity.ok(BaseResponse.success(decision));
    }

    @PostMapping("/admission")
    public ResponseEntity<BaseResponse<AdmissionResult>> admit(@Valid @RequestBody BookingRequest request) {
        AdmissionResult result = admissionService.admit(request.toCandidate(), request.toOptions());
        return ResponseEntity.ok(BaseResponse.success(result));
    }
}
