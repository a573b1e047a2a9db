package org.ecaflow.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An action reachable from one event along more than one path.
 */
@JsonPropertyOrder({"event", "action", "paths_count", "issue"})
public record RedundancyFinding(
        @JsonProperty("event") String event,
        @JsonProperty("action") String action,
        @JsonProperty("paths_count") int pathsCount
) {
    public static final String ISSUE = "Redundancy: action reachable more than once from event";

    @JsonProperty("issue")
    public String issue() {
        return ISSUE;
    }
}
