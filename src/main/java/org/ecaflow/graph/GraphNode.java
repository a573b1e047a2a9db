package org.ecaflow.graph;

/**
 * Vertex of the flow graph. The index is the node's stable handle in its
 * {@link NodeRegistry}; two handles are the same vertex iff they are equal.
 */
public sealed interface GraphNode permits GraphNode.EventNode, GraphNode.ActionNode {

    int index();

    String label();

    // ========================================================================
    // Node Types
    // ========================================================================

    record EventNode(int index, EventKey key) implements GraphNode {
        public String label() { return key.label(); }

        public String kind() { return key.kind(); }

        @Override
        public String toString() { return label(); }
    }

    record ActionNode(int index, ActionKey key) implements GraphNode {
        public String label() { return key.label(); }

        public String signature() { return key.signature(); }

        public String entityId() { return key.entityId(); }

        public String resultingState() { return key.resultingState(); }

        /**
         * Whether the effect catalog knows what this action does to its entity.
         */
        public boolean isCataloged() { return key.hasEffect(); }

        @Override
        public String toString() { return label(); }
    }
}
