package org.ecaflow.analysis;

import org.ecaflow.graph.FlowEdge;
import org.ecaflow.graph.FlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Counts trigger-edges per (event, action) pair. Every edge is one path, so
 * a count above one means the action is reached more than once.
 */
public class RedundancyAnalyzer implements AnalysisPass<RedundancyFinding> {

    private static final Logger log = LoggerFactory.getLogger(RedundancyAnalyzer.class);

    /**
     * Ordered (event, action) node index pair.
     */
    public record NodePair(int event, int action) {}

    @Override
    public String getName() {
        return "redundancy";
    }

    @Override
    public List<RedundancyFinding> analyze(FlowGraph graph) {
        List<RedundancyFinding> findings = new ArrayList<>();
        for (Map.Entry<NodePair, Integer> entry : pathCounts(graph).entrySet()) {
            int count = entry.getValue();
            if (count > 1) {
                NodePair pair = entry.getKey();
                findings.add(new RedundancyFinding(
                    graph.getNode(pair.event()).label(),
                    graph.getNode(pair.action()).label(),
                    count));
            }
        }
        log.info("Redundancy: {} finding(s)", findings.size());
        return findings;
    }

    /**
     * Path count for every pair joined by at least one trigger-edge, in order
     * of first appearance.
     */
    public Map<NodePair, Integer> pathCounts(FlowGraph graph) {
        Map<NodePair, Integer> counts = new LinkedHashMap<>();
        for (FlowEdge edge : graph.getTriggerEdges()) {
            counts.merge(new NodePair(edge.source(), edge.target()), 1, Integer::sum);
        }
        return counts;
    }
}
