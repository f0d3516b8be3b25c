package com.spacebooking.scheduling.domain.model;

import java.util.List;

/**
 * Result of a conflict check. {@code canProceed} holds exactly when {@code conflicts} is empty.
 */
public record ConflictReport(List<Conflict> conflicts, boolean canProceed, List<String> suggestions) {

    public ConflictReport {
        conflicts = List.copyOf(conflicts);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        if (canProceed != conflicts.isEmpty()) {
            throw new IllegalArgumentException("canProceed must be true exactly when there are no conflicts");
        }
    }

    public static ConflictReport clear() {
        return new ConflictReport(List.of(), true, List.of());
    }

    public static ConflictReport of(List<Conflict> conflicts, List<String> suggestions) {
        return new ConflictReport(conflicts, conflicts.isEmpty(), suggestions);
    }
}
