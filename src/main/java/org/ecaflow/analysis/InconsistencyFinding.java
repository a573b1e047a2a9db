package org.ecaflow.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Two opposing actions on the same entity, both reachable from one event.
 * {@code action1} is the one first reached from the event.
 */
@JsonPropertyOrder({"event", "action1", "action2", "entity", "issue"})
public record InconsistencyFinding(
        @JsonProperty("event") String event,
        @JsonProperty("action1") String action1,
        @JsonProperty("action2") String action2,
        @JsonProperty("entity") String entity
) {
    public static final String ISSUE = "Inconsistency: conflicting actions reachable from same event";

    @JsonProperty("issue")
    public String issue() {
        return ISSUE;
    }
}
