package org.ecaflow.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.ecaflow.graph.FlowGraph;

import java.util.List;

/**
 * Findings of all passes plus graph size, in the order they are emitted.
 */
@JsonPropertyOrder({"summary", "redundancy", "inconsistency", "circularity"})
public record AnalysisReport(
        @JsonProperty("summary") Summary summary,
        @JsonProperty("redundancy") List<RedundancyFinding> redundancy,
        @JsonProperty("inconsistency") List<InconsistencyFinding> inconsistency,
        @JsonProperty("circularity") List<CircularityFinding> circularity
) {
    public AnalysisReport {
        redundancy = List.copyOf(redundancy);
        inconsistency = List.copyOf(inconsistency);
        circularity = List.copyOf(circularity);
    }

    public static AnalysisReport of(FlowGraph graph,
                                    List<RedundancyFinding> redundancy,
                                    List<InconsistencyFinding> inconsistency,
                                    List<CircularityFinding> circularity) {
        Summary summary = new Summary(
            graph.getEventCount(),
            graph.getActionCount(),
            graph.getEdgeCount(),
            redundancy.size(),
            inconsistency.size(),
            circularity.size());
        return new AnalysisReport(summary, redundancy, inconsistency, circularity);
    }

    public int totalFindings() {
        return redundancy.size() + inconsistency.size() + circularity.size();
    }

    public boolean hasFindings() {
        return totalFindings() > 0;
    }

    @JsonPropertyOrder({"events", "actions", "edges",
        "redundancy_issues", "inconsistency_issues", "circularity_issues"})
    public record Summary(
            @JsonProperty("events") int events,
            @JsonProperty("actions") int actions,
            @JsonProperty("edges") int edges,
            @JsonProperty("redundancy_issues") int redundancyIssues,
            @JsonProperty("inconsistency_issues") int inconsistencyIssues,
            @JsonProperty("circularity_issues") int circularityIssues
    ) {}
}
