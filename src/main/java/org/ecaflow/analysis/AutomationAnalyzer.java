package org.ecaflow.analysis;

import org.ecaflow.graph.FlowGraph;
import org.ecaflow.graph.GraphBuilder;
import org.ecaflow.model.Automation;
import org.ecaflow.model.ServiceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Builds the flow graph for a set of automations and runs the enabled passes.
 *
 * Usage:
 * <pre>
 * AutomationAnalyzer analyzer = new AutomationAnalyzer(catalog, AnalysisConfig.defaults());
 * AnalysisResult result = analyzer.analyze(automations);
 * AnalysisReport report = result.getReport();
 * </pre>
 */
public class AutomationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AutomationAnalyzer.class);

    // ========================================================================
    // Configuration
    // ========================================================================

    /**
     * Which passes run and whether they run concurrently.
     */
    public static class AnalysisConfig {
        private final boolean redundancyEnabled;
        private final boolean inconsistencyEnabled;
        private final boolean circularityEnabled;
        private final boolean parallel;

        private AnalysisConfig(Builder builder) {
            this.redundancyEnabled = builder.redundancyEnabled;
            this.inconsistencyEnabled = builder.inconsistencyEnabled;
            this.circularityEnabled = builder.circularityEnabled;
            this.parallel = builder.parallel;
        }

        /**
         * All three passes, run one after another.
         */
        public static AnalysisConfig defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public boolean isRedundancyEnabled() { return redundancyEnabled; }
        public boolean isInconsistencyEnabled() { return inconsistencyEnabled; }
        public boolean isCircularityEnabled() { return circularityEnabled; }
        public boolean isParallel() { return parallel; }

        @Override
        public String toString() {
            return String.format("AnalysisConfig[redundancy=%s, inconsistency=%s, circularity=%s, parallel=%s]",
                redundancyEnabled, inconsistencyEnabled, circularityEnabled, parallel);
        }

        public static class Builder {
            private boolean redundancyEnabled = true;
            private boolean inconsistencyEnabled = true;
            private boolean circularityEnabled = true;
            private boolean parallel = false;

            public Builder redundancy(boolean enabled) { this.redundancyEnabled = enabled; return this; }
            public Builder inconsistency(boolean enabled) { this.inconsistencyEnabled = enabled; return this; }
            public Builder circularity(boolean enabled) { this.circularityEnabled = enabled; return this; }
            public Builder parallel(boolean parallel) { this.parallel = parallel; return this; }

            public AnalysisConfig build() {
                return new AnalysisConfig(this);
            }
        }
    }

    // ========================================================================
    // Result
    // ========================================================================

    /**
     * The graph the passes ran on, and their report.
     */
    public static class AnalysisResult {
        private final FlowGraph graph;
        private final AnalysisReport report;

        public AnalysisResult(FlowGraph graph, AnalysisReport report) {
            this.graph = graph;
            this.report = report;
        }

        public FlowGraph getGraph() { return graph; }
        public AnalysisReport getReport() { return report; }

        @Override
        public String toString() {
            return String.format("AnalysisResult[%s, findings=%d]", graph, report.totalFindings());
        }
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    private final GraphBuilder builder;
    private final AnalysisConfig config;
    private final RedundancyAnalyzer redundancy;
    private final InconsistencyAnalyzer inconsistency;
    private final CircularityAnalyzer circularity;

    public AutomationAnalyzer(ServiceCatalog catalog) {
        this(catalog, AnalysisConfig.defaults());
    }

    public AutomationAnalyzer(ServiceCatalog catalog, AnalysisConfig config) {
        this.builder = new GraphBuilder(catalog);
        this.config = config;
        this.redundancy = new RedundancyAnalyzer();
        this.inconsistency = new InconsistencyAnalyzer(catalog);
        this.circularity = new CircularityAnalyzer();
    }

    public AnalysisResult analyze(List<Automation> automations) {
        FlowGraph graph = builder.build(automations);
        return new AnalysisResult(graph, analyze(graph));
    }

    /**
     * Run the enabled passes over an already built graph.
     */
    public AnalysisReport analyze(FlowGraph graph) {
        log.debug("Running passes with {}", config);
        if (config.isParallel()) {
            return analyzeConcurrently(graph);
        }
        return AnalysisReport.of(graph,
            run(redundancy, config.isRedundancyEnabled(), graph),
            run(inconsistency, config.isInconsistencyEnabled(), graph),
            run(circularity, config.isCircularityEnabled(), graph));
    }

    private AnalysisReport analyzeConcurrently(FlowGraph graph) {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            CompletableFuture<List<RedundancyFinding>> redundancyFuture = CompletableFuture.supplyAsync(
                () -> run(redundancy, config.isRedundancyEnabled(), graph), executor);
            CompletableFuture<List<InconsistencyFinding>> inconsistencyFuture = CompletableFuture.supplyAsync(
                () -> run(inconsistency, config.isInconsistencyEnabled(), graph), executor);
            CompletableFuture<List<CircularityFinding>> circularityFuture = CompletableFuture.supplyAsync(
                () -> run(circularity, config.isCircularityEnabled(), graph), executor);

            return AnalysisReport.of(graph,
                redundancyFuture.join(),
                inconsistencyFuture.join(),
                circularityFuture.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    private static <F> List<F> run(AnalysisPass<F> pass, boolean enabled, FlowGraph graph) {
        if (!enabled) {
            log.debug("Pass '{}' disabled", pass.getName());
            return List.of();
        }
        return pass.analyze(graph);
    }
}
