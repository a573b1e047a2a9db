package org.ecaflow.graph;

import org.ecaflow.graph.GraphNode.ActionNode;
import org.ecaflow.graph.GraphNode.EventNode;

import java.util.*;

/**
 * Arena of graph nodes keyed by canonical identity.
 *
 * The first request for a key creates the node and assigns it the next
 * index; later requests for an equal key return the same handle. Owned by
 * a single {@link GraphBuilder} run and not thread-safe.
 */
public class NodeRegistry {

    private final List<GraphNode> nodes;
    private final Map<EventKey, EventNode> eventsByKey;
    private final Map<ActionKey, ActionNode> actionsByKey;

    public NodeRegistry() {
        this.nodes = new ArrayList<>();
        this.eventsByKey = new LinkedHashMap<>();
        this.actionsByKey = new LinkedHashMap<>();
    }

    // ========================================================================
    // Registration
    // ========================================================================

    public EventNode event(EventKey key) {
        EventNode existing = eventsByKey.get(key);
        if (existing != null) {
            return existing;
        }
        EventNode node = new EventNode(nodes.size(), key);
        nodes.add(node);
        eventsByKey.put(key, node);
        return node;
    }

    public ActionNode action(ActionKey key) {
        ActionNode existing = actionsByKey.get(key);
        if (existing != null) {
            return existing;
        }
        ActionNode node = new ActionNode(nodes.size(), key);
        nodes.add(node);
        actionsByKey.put(key, node);
        return node;
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    public Optional<EventNode> findEvent(EventKey key) {
        return Optional.ofNullable(eventsByKey.get(key));
    }

    public boolean containsAction(ActionKey key) {
        return actionsByKey.containsKey(key);
    }

    /**
     * All nodes in creation order; a node's position equals its index.
     */
    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Collection<EventNode> getEventNodes() {
        return Collections.unmodifiableCollection(eventsByKey.values());
    }

    public Collection<ActionNode> getActionNodes() {
        return Collections.unmodifiableCollection(actionsByKey.values());
    }

    public int size() {
        return nodes.size();
    }
}
