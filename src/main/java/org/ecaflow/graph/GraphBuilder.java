package org.ecaflow.graph;

import org.ecaflow.graph.GraphNode.ActionNode;
import org.ecaflow.graph.GraphNode.EventNode;
import org.ecaflow.graph.RuleFlattener.FlattenedRule;
import org.ecaflow.model.Automation;
import org.ecaflow.model.ServiceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles a set of automations into a {@link FlowGraph}.
 *
 * Pass one registers every Event and Action node and adds one trigger-edge
 * per (trigger, reachable path). Pass two adds effect-edges from cataloged
 * actions to the state triggers they satisfy, once all events are known.
 * Each call to {@link #build} uses a fresh registry, so the builder can be
 * reused.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final ServiceCatalog catalog;

    public GraphBuilder(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public FlowGraph build(List<Automation> automations) {
        NodeRegistry registry = new NodeRegistry();
        List<BuildDiagnostic> diagnostics = new ArrayList<>();
        NodeCanonicalizer canonicalizer = new NodeCanonicalizer(registry, catalog, diagnostics::add);
        RuleFlattener flattener = new RuleFlattener(canonicalizer, diagnostics::add);

        List<FlowEdge> edges = new ArrayList<>();

        // Pass 1: nodes and trigger-edges
        for (Automation automation : automations) {
            if (!automation.hasTriggers() || !automation.hasActions()) {
                String detail = automation.hasTriggers() ? "no actions" : "no triggers";
                log.info("Skipping automation '{}': {}", automation.id(), detail);
                diagnostics.add(new BuildDiagnostic.MalformedRuleStructure(automation.id(), "automation", detail));
                continue;
            }
            FlattenedRule rule = flattener.flatten(automation);
            for (EventNode event : rule.events()) {
                for (ActionNode action : rule.actionPaths()) {
                    edges.add(FlowEdge.trigger(event, action, rule.automationId()));
                }
            }
        }
        int triggerEdges = edges.size();

        // Pass 2: effect-edges against the completed event set
        for (ActionNode action : registry.getActionNodes()) {
            if (!action.isCataloged()) {
                continue;
            }
            registry.findEvent(EventKey.stateChange(action.entityId(), action.resultingState()))
                .ifPresent(event -> {
                    log.debug("Effect edge {} -> {}", action.label(), event.label());
                    edges.add(FlowEdge.effect(action, event));
                });
        }

        for (BuildDiagnostic diagnostic : diagnostics) {
            if (diagnostic instanceof BuildDiagnostic.MissingCatalogEntry) {
                log.info("{}: {}", diagnostic.automationId(), diagnostic.message());
            } else {
                log.warn("{}: {}", diagnostic.automationId(), diagnostic.message());
            }
        }

        FlowGraph graph = new FlowGraph(registry.getNodes(), edges, diagnostics);
        log.info("Built flow graph from {} automation(s): {} events, {} actions, {} trigger edges, {} effect edges",
            automations.size(), graph.getEventCount(), graph.getActionCount(),
            triggerEdges, edges.size() - triggerEdges);
        return graph;
    }
}
