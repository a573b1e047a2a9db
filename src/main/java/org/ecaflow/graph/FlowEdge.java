package org.ecaflow.graph;

/**
 * Directed edge of the flow multigraph. Parallel edges between the same
 * pair of nodes are distinct edges.
 *
 * @param source       index of the source node
 * @param target       index of the target node
 * @param kind         trigger-edge (Event to Action) or effect-edge (Action to Event)
 * @param automationId automation that produced a trigger-edge; null for effect-edges
 */
public record FlowEdge(int source, int target, Kind kind, String automationId) {

    public enum Kind {
        TRIGGER,
        EFFECT
    }

    public static FlowEdge trigger(GraphNode.EventNode event, GraphNode.ActionNode action, String automationId) {
        return new FlowEdge(event.index(), action.index(), Kind.TRIGGER, automationId);
    }

    public static FlowEdge effect(GraphNode.ActionNode action, GraphNode.EventNode event) {
        return new FlowEdge(action.index(), event.index(), Kind.EFFECT, null);
    }

    public boolean isTrigger() {
        return kind == Kind.TRIGGER;
    }

    @Override
    public String toString() {
        return String.format("%d -[%s]-> %d", source, kind, target);
    }
}
