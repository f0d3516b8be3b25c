package com.spacebooking.scheduling.api.dto;

import com.spacebooking.scheduling.domain.model.CommitOutcome;
import com.spacebooking.scheduling.domain.model.ConflictReport;

import java.util.List;

public record CommitResponse(
        CommitOutcome.Status status,
        boolean replayed,
        List<SlotResponse> slots,
        ConflictReport conflictReport
) {
    public static CommitResponse from(CommitOutcome outcome) {
        return new CommitResponse(
                outcome.status(),
                outcome.replayed(),
                SlotResponse.fromAll(outcome.slots()),
                outcome.conflictReport()
        );
    }
}
