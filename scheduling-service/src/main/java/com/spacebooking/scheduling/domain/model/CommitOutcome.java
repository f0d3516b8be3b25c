package com.spacebooking.scheduling.domain.model;

import java.util.List;

/**
 * Result of committing an interval to a booking. A conflict is a normal outcome, not an exception.
 *
 * @param replayed true when the same booking had already committed this interval and nothing changed
 */
public record CommitOutcome(Status status, List<Slot> slots, ConflictReport conflictReport, boolean replayed) {

    public enum Status {
        COMMITTED,
        CONFLICT
    }

    public static CommitOutcome committed(List<Slot> slots, boolean replayed) {
        return new CommitOutcome(Status.COMMITTED, List.copyOf(slots), ConflictReport.clear(), replayed);
    }

    public static CommitOutcome conflict(ConflictReport report) {
        return new CommitOutcome(Status.CONFLICT, List.of(), report, false);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
