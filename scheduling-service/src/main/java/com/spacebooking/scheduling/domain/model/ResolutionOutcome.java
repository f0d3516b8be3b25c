package com.spacebooking.scheduling.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.spacebooking.scheduling.domain.interval.TimeInterval;

import java.util.List;

/**
 * What the resolver proposes for a conflicting request. Serialized with an {@code outcome} tag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ResolutionOutcome.Resolved.class, name = "RESOLVED"),
        @JsonSubTypes.Type(value = ResolutionOutcome.AlternativesFound.class, name = "ALTERNATIVES_FOUND"),
        @JsonSubTypes.Type(value = ResolutionOutcome.ManualActionRequired.class, name = "MANUAL_ACTION_REQUIRED")
})
public interface ResolutionOutcome {

    /**
     * Same day, conflict-free interval. {@code shiftMinutes} is 0 when the original request was already free.
     */
    record Resolved(TimeInterval newInterval, int shiftMinutes, String message) implements ResolutionOutcome {
    }

    /**
     * Ranked proposals on other days; advisory until committed.
     */
    record AlternativesFound(List<Alternative> alternatives) implements ResolutionOutcome {
        public AlternativesFound {
            alternatives = List.copyOf(alternatives);
        }
    }

    record ManualActionRequired(String message) implements ResolutionOutcome {
    }
}
