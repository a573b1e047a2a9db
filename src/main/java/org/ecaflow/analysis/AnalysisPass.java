package org.ecaflow.analysis;

import org.ecaflow.graph.FlowGraph;

import java.util.List;

/**
 * Read-only pass over a completed flow graph. Passes share no mutable state
 * and may run concurrently on the same graph.
 *
 * @param <F> finding type
 */
public interface AnalysisPass<F> {

    String getName();

    List<F> analyze(FlowGraph graph);
}
