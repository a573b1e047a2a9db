package org.ecaflow.analysis;

import org.ecaflow.graph.FlowEdge;
import org.ecaflow.graph.FlowGraph;
import org.ecaflow.graph.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds cycles in the flow graph with Tarjan's strongly connected
 * components algorithm.
 *
 * Every component with more than one node yields one finding, in the order
 * Tarjan completes them. The reported cycle is a shortest cycle through the
 * component's lowest-index Event node.
 */
public class CircularityAnalyzer implements AnalysisPass<CircularityFinding> {

    private static final Logger log = LoggerFactory.getLogger(CircularityAnalyzer.class);

    @Override
    public String getName() {
        return "circularity";
    }

    @Override
    public List<CircularityFinding> analyze(FlowGraph graph) {
        List<CircularityFinding> findings = new ArrayList<>();
        for (List<Integer> component : stronglyConnectedComponents(graph)) {
            if (component.size() < 2) {
                continue;
            }
            List<Integer> cycle = representativeCycle(graph, component);
            List<String> labels = new ArrayList<>(cycle.size());
            for (int index : cycle) {
                labels.add(graph.getNode(index).label());
            }
            log.debug("Cycle over {} node(s) in component of {}", cycle.size(), component.size());
            findings.add(new CircularityFinding(cycle, labels));
        }
        log.info("Circularity: {} finding(s)", findings.size());
        return findings;
    }

    // ========================================================================
    // Tarjan
    // ========================================================================

    /**
     * All strongly connected components, in completion order. Iterative, so
     * long chains cannot overflow the call stack.
     */
    public List<List<Integer>> stronglyConnectedComponents(FlowGraph graph) {
        int n = graph.getNodeCount();
        int[] index = new int[n];
        int[] lowlink = new int[n];
        int[] edgeCursor = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> callStack = new ArrayDeque<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            index[root] = lowlink[root] = counter++;
            stack.push(root);
            onStack[root] = true;
            callStack.push(root);

            while (!callStack.isEmpty()) {
                int v = callStack.peek();
                List<FlowEdge> out = graph.outgoing(v);

                if (edgeCursor[v] < out.size()) {
                    int w = out.get(edgeCursor[v]++).target();
                    if (index[w] == -1) {
                        index[w] = lowlink[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        callStack.push(w);
                    } else if (onStack[w]) {
                        lowlink[v] = Math.min(lowlink[v], index[w]);
                    }
                    continue;
                }

                callStack.pop();
                if (lowlink[v] == index[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    Collections.sort(component);
                    components.add(component);
                }
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek();
                    lowlink[parent] = Math.min(lowlink[parent], lowlink[v]);
                }
            }
        }
        return components;
    }

    // ========================================================================
    // Cycle Extraction
    // ========================================================================

    /**
     * Shortest cycle inside the component through its lowest-index Event
     * node, found by breadth-first search. The start node is listed once.
     */
    List<Integer> representativeCycle(FlowGraph graph, List<Integer> component) {
        Set<Integer> members = new HashSet<>(component);
        int start = component.get(0);
        for (int index : component) {
            if (graph.getNode(index) instanceof GraphNode.EventNode) {
                start = index;
                break;
            }
        }

        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        parent.put(start, -1);

        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (FlowEdge edge : graph.outgoing(u)) {
                int w = edge.target();
                if (!members.contains(w)) {
                    continue;
                }
                if (w == start) {
                    LinkedList<Integer> path = new LinkedList<>();
                    for (int node = u; node != -1; node = parent.get(node)) {
                        path.addFirst(node);
                    }
                    return path;
                }
                if (!parent.containsKey(w)) {
                    parent.put(w, u);
                    queue.add(w);
                }
            }
        }
        // unreachable for a component of two or more nodes
        throw new IllegalStateException("No cycle through node " + start + " in component " + component);
    }
}
