package org.ecaflow.graph;

import org.ecaflow.graph.GraphNode.ActionNode;
import org.ecaflow.graph.GraphNode.EventNode;

import java.util.*;

/**
 * Immutable directed multigraph over Event and Action nodes.
 *
 * Node {@code i} sits at position {@code i} of {@link #getNodes()}. Outgoing
 * edges of each node keep insertion order, which makes every traversal of
 * the same input deterministic.
 */
public final class FlowGraph {

    private final List<GraphNode> nodes;
    private final List<FlowEdge> edges;
    private final List<List<FlowEdge>> outgoing;
    private final List<BuildDiagnostic> diagnostics;

    FlowGraph(List<GraphNode> nodes, List<FlowEdge> edges, List<BuildDiagnostic> diagnostics) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.diagnostics = List.copyOf(diagnostics);

        List<List<FlowEdge>> adjacency = new ArrayList<>(this.nodes.size());
        for (int i = 0; i < this.nodes.size(); i++) {
            adjacency.add(new ArrayList<>());
        }
        for (FlowEdge edge : this.edges) {
            adjacency.get(edge.source()).add(edge);
        }
        List<List<FlowEdge>> frozen = new ArrayList<>(adjacency.size());
        for (List<FlowEdge> list : adjacency) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.outgoing = Collections.unmodifiableList(frozen);
    }

    // ========================================================================
    // Nodes
    // ========================================================================

    public List<GraphNode> getNodes() { return nodes; }

    public GraphNode getNode(int index) { return nodes.get(index); }

    public int getNodeCount() { return nodes.size(); }

    public List<EventNode> getEventNodes() {
        List<EventNode> events = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (node instanceof EventNode event) {
                events.add(event);
            }
        }
        return events;
    }

    public List<ActionNode> getActionNodes() {
        List<ActionNode> actions = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (node instanceof ActionNode action) {
                actions.add(action);
            }
        }
        return actions;
    }

    public int getEventCount() { return getEventNodes().size(); }

    public int getActionCount() { return getActionNodes().size(); }

    /**
     * First node carrying the given report label.
     */
    public Optional<GraphNode> findByLabel(String label) {
        return nodes.stream().filter(n -> n.label().equals(label)).findFirst();
    }

    // ========================================================================
    // Edges
    // ========================================================================

    public List<FlowEdge> getEdges() { return edges; }

    public int getEdgeCount() { return edges.size(); }

    public List<FlowEdge> getTriggerEdges() {
        return edges.stream().filter(FlowEdge::isTrigger).toList();
    }

    public List<FlowEdge> getEffectEdges() {
        return edges.stream().filter(e -> !e.isTrigger()).toList();
    }

    public List<FlowEdge> outgoing(int source) {
        return outgoing.get(source);
    }

    /**
     * Targets of the outgoing edges of a node; parallel edges repeat the target.
     */
    public List<Integer> successors(int source) {
        List<Integer> targets = new ArrayList<>();
        for (FlowEdge edge : outgoing.get(source)) {
            targets.add(edge.target());
        }
        return targets;
    }

    public boolean hasEdge(int source, int target) {
        for (FlowEdge edge : outgoing.get(source)) {
            if (edge.target() == target) {
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // Diagnostics
    // ========================================================================

    public List<BuildDiagnostic> getDiagnostics() { return diagnostics; }

    @Override
    public String toString() {
        return String.format("FlowGraph[events=%d, actions=%d, edges=%d, diagnostics=%d]",
            getEventCount(), getActionCount(), edges.size(), diagnostics.size());
    }
}
