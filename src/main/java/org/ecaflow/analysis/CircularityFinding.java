package org.ecaflow.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One directed cycle through a strongly connected component.
 *
 * @param nodeIndices graph indices of the cycle, starting node first and not repeated
 * @param labels      labels of the same nodes
 */
@JsonPropertyOrder({"cycle_nodes", "size", "issue"})
public record CircularityFinding(
        @JsonIgnore List<Integer> nodeIndices,
        @JsonIgnore List<String> labels
) {
    public static final String ISSUE = "Circularity: cycle in event flow graph";
    public static final String SEPARATOR = " → ";

    public CircularityFinding {
        nodeIndices = List.copyOf(nodeIndices);
        labels = List.copyOf(labels);
    }

    @JsonProperty("cycle_nodes")
    public String cycleNodes() {
        return labels.stream().collect(Collectors.joining(SEPARATOR));
    }

    @JsonProperty("size")
    public int size() {
        return nodeIndices.size();
    }

    @JsonProperty("issue")
    public String issue() {
        return ISSUE;
    }
}
