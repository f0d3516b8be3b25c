package com.spacebooking.scheduling.api.controller;

import com.spacebooking.common.dto.BaseResponse;
import com.spacebooking.scheduling.api.dto.BlockSlotsRequest;
import com.spacebooking.scheduling.api.dto.BookingStatusChangeRequest;
import com.spacebooking.scheduling.api.dto.CommitResponse;
import com.spacebooking.scheduling.api.dto.GenerateRecurringSlotsRequest;
import com.spacebooking.scheduling.api.dto.GenerateSlotsRequest;
import com.spacebooking.scheduling.api.dto.OptimizeSlotsRequest;
import com.spacebooking.scheduling.api.dto.SlotCommitRequest;
import com.spacebooking.scheduling.api.dto.SlotResponse;
import com.spacebooking.scheduling.domain.model.CommitOutcome;
import com.spacebooking.scheduling.domain.model.OptimizationResult;
import com.spacebooking.scheduling.domain.service.SlotCommitService;
import com.spacebooking.scheduling.domain.service.SlotSupplyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Slot lifecycle: commit/release for bookings, block/unblock for administrators, supply generation and
 * optimization. A refused commit or block answers 409 with the conflict report as payload.
 */
@RestController
@RequestMapping("/api/v1/slots")
@RequiredArgsConstructor
public class SlotController {

    private final SlotCommitService commitService;
    private final SlotSupplyService supplyService;

    @GetMapping("/{resourceId}")
    public ResponseEntity<BaseResponse<List<SlotResponse>>> getSlots(
            @PathVariable String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(SlotResponse.fromAll(supplyService.getSlots(resourceId, date))));
    }

    @PostMapping("/commit")
    public ResponseEntity<BaseResponse<CommitResponse>> commit(@Valid @RequestBody SlotCommitRequest request) {
        CommitOutcome outcome = commitService.commit(
                request.resourceId(), request.date(), request.toInterval(), request.bookingId());
        return toResponse(outcome, "Slots committed successfully");
    }

    @PostMapping("/release")
    public ResponseEntity<BaseResponse<List<SlotResponse>>> release(@Valid @RequestBody SlotCommitRequest request) {
        List<SlotResponse> released = SlotResponse.fromAll(commitService.release(
                request.resourceId(), request.date(), request.toInterval(), request.bookingId()));
        return ResponseEntity.ok(BaseResponse.success("Released " + released.size() + " slot(s)", released));
    }

    @PostMapping("/booking-status")
    public ResponseEntity<BaseResponse<List<SlotResponse>>> bookingStatusChanged(
            @Valid @RequestBody BookingStatusChangeRequest request) {
        List<SlotResponse> released = SlotResponse.fromAll(commitService.applyBookingStatus(
                request.resourceId(), request.date(), request.toInterval(), request.bookingId(), request.status()));
        return ResponseEntity.ok(BaseResponse.success("Released " + released.size() + " slot(s)", released));
    }

    @PostMapping("/block")
    public ResponseEntity<BaseResponse<CommitResponse>> block(@Valid @RequestBody BlockSlotsRequest request) {
        CommitOutcome outcome = supplyService.block(request.resourceId(), request.date(), request.toInterval(),
                request.reason(), request.blockedBy());
        return toResponse(outcome, "Slots blocked successfully");
    }

    @PostMapping("/unblock")
    public ResponseEntity<BaseResponse<List<SlotResponse>>> unblock(@Valid @RequestBody BlockSlotsRequest request) {
        List<SlotResponse> unblocked = SlotResponse.fromAll(
                supplyService.unblock(request.resourceId(), request.date(), request.toInterval()));
        return ResponseEntity.ok(BaseResponse.success("Unblocked " + unblocked.size() + " slot(s)", unblocked));
    }

    @PostMapping("/generate")
    public ResponseEntity<BaseResponse<List<SlotResponse>>> generate(@Valid @RequestBody GenerateSlotsRequest request) {
        List<SlotResponse> created = SlotResponse.fromAll(supplyService.generateSlots(
                request.resourceId(), request.startDate(), request.endDate(),
                request.toOptions(supplyService.defaultGenerationOptions())));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Generated " + created.size() + " slot(s)", created));
    }

    @PostMapping("/generate-recurring")
    public ResponseEntity<BaseResponse<List<SlotResponse>>> generateRecurring(
            @Valid @RequestBody GenerateRecurringSlotsRequest request) {
        List<SlotResponse> created = SlotResponse.fromAll(supplyService.generateRecurring(
                request.resourceId(), request.startDate(), request.endDate(),
                request.toDailyWindow(), request.toPattern()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Generated " + created.size() + " recurring slot(s)", created));
    }

    @PostMapping("/optimize")
    public ResponseEntity<BaseResponse<OptimizationResult>> optimize(@Valid @RequestBody OptimizeSlotsRequest request) {
        OptimizationResult result = supplyService.optimize(
                request.resourceId(), request.startDate(), request.endDate(), request.toOptions());
        return ResponseEntity.ok(BaseResponse.success(result));
    }

    private ResponseEntity<BaseResponse<CommitResponse>> toResponse(CommitOutcome outcome, String successMessage) {
        CommitResponse body = CommitResponse.from(outcome);
        if (!outcome.isCommitted()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(BaseResponse.rejected("Requested time conflicts with existing slots", "SLOT_CONFLICT", body));
        }
        return ResponseEntity.ok(BaseResponse.success(successMessage, body));
    }
}
