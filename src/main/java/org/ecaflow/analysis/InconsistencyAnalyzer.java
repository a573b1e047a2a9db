package org.ecaflow.analysis;

import org.ecaflow.graph.FlowEdge;
import org.ecaflow.graph.FlowGraph;
import org.ecaflow.graph.GraphNode.ActionNode;
import org.ecaflow.graph.GraphNode.EventNode;
import org.ecaflow.model.ServiceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Flags opposing actions on the same entity that one event can reach.
 *
 * Only cataloged actions take part: an action with no known effect has no
 * defined opposite. Each unordered pair is reported at most once per event,
 * with the action reached first in {@code action1}.
 */
public class InconsistencyAnalyzer implements AnalysisPass<InconsistencyFinding> {

    private static final Logger log = LoggerFactory.getLogger(InconsistencyAnalyzer.class);

    private final ServiceCatalog catalog;

    public InconsistencyAnalyzer(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public String getName() {
        return "inconsistency";
    }

    @Override
    public List<InconsistencyFinding> analyze(FlowGraph graph) {
        List<InconsistencyFinding> findings = new ArrayList<>();
        for (EventNode event : graph.getEventNodes()) {
            List<ActionNode> reachable = reachableActions(graph, event);
            for (int i = 0; i < reachable.size(); i++) {
                ActionNode first = reachable.get(i);
                for (int j = i + 1; j < reachable.size(); j++) {
                    ActionNode second = reachable.get(j);
                    if (opposing(first, second)) {
                        findings.add(new InconsistencyFinding(
                            event.label(), first.label(), second.label(), first.entityId()));
                    }
                }
            }
        }
        log.info("Inconsistency: {} finding(s)", findings.size());
        return findings;
    }

    /**
     * Distinct actions on the event's trigger-edges, in edge order.
     */
    List<ActionNode> reachableActions(FlowGraph graph, EventNode event) {
        Set<Integer> seen = new LinkedHashSet<>();
        for (FlowEdge edge : graph.outgoing(event.index())) {
            if (edge.isTrigger()) {
                seen.add(edge.target());
            }
        }
        List<ActionNode> actions = new ArrayList<>(seen.size());
        for (int index : seen) {
            actions.add((ActionNode) graph.getNode(index));
        }
        return actions;
    }

    private boolean opposing(ActionNode a, ActionNode b) {
        return a.entityId() != null
            && a.entityId().equals(b.entityId())
            && a.isCataloged()
            && b.isCataloged()
            && catalog.conflicts(a.signature(), b.signature());
    }
}
