package org.ecaflow.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ecaflow.analysis.AutomationAnalyzer.AnalysisConfig;
import org.ecaflow.analysis.AutomationAnalyzer.AnalysisResult;
import org.ecaflow.config.AutomationConfigLoader;
import org.ecaflow.config.CatalogConfigLoader;
import org.ecaflow.model.Automation;
import org.ecaflow.model.ServiceCatalog;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class AutomationAnalyzerTest {

    private static final ServiceCatalog CATALOG = new CatalogConfigLoader().loadDefault();

    private static List<Automation> fixture(String name) throws Exception {
        try (InputStream in = AutomationAnalyzerTest.class.getResourceAsStream("/automations/" + name)) {
            return new AutomationConfigLoader().loadFromStream(in);
        }
    }

    private static AnalysisReport analyze(String name) throws Exception {
        return new AutomationAnalyzer(CATALOG).analyze(fixture(name)).getReport();
    }

    @Test
    void shouldFindSingleCycleThroughThreeAutomations() throws Exception {
        // When
        AnalysisReport report = analyze("circular.yaml");

        // Then
        assertThat(report.circularity()).singleElement()
            .extracting(CircularityFinding::size).isEqualTo(6);
        assertThat(report.redundancy()).isEmpty();
        assertThat(report.inconsistency()).isEmpty();
        assertThat(report.summary()).isEqualTo(new AnalysisReport.Summary(3, 3, 6, 0, 0, 1));
    }

    @Test
    void shouldFindConflictingBranches() throws Exception {
        // When
        AnalysisReport report = analyze("conflicting.yaml");

        // Then
        assertThat(report.inconsistency()).singleElement()
            .extracting(InconsistencyFinding::entity).isEqualTo("light.l1");
        assertThat(report.redundancy()).isEmpty();
        assertThat(report.circularity()).isEmpty();
    }

    @Test
    void shouldFindActionReachedTwice() throws Exception {
        // When
        AnalysisReport report = analyze("redundant.yaml");

        // Then
        assertThat(report.redundancy()).singleElement().satisfies(finding -> {
            assertThat(finding.event()).isEqualTo("E:state(binary_sensor.motion_1→on)");
            assertThat(finding.action()).isEqualTo("A:media_player.play(media_player.mp1=playing)");
            assertThat(finding.pathsCount()).isEqualTo(2);
        });
    }

    @Test
    void shouldReachNothingAfterLeadingStop() throws Exception {
        // When
        AnalysisResult result = new AutomationAnalyzer(CATALOG).analyze(fixture("stop-first.yaml"));

        // Then
        assertThat(result.getGraph().getEdgeCount()).isZero();
        assertThat(result.getReport().hasFindings()).isFalse();
    }

    @Test
    void shouldMatchSequentialResultsWhenRunConcurrently() throws Exception {
        // Given
        List<Automation> automations = new ArrayList<>();
        automations.addAll(fixture("circular.yaml"));
        automations.addAll(fixture("conflicting.yaml"));
        automations.addAll(fixture("redundant.yaml"));
        AnalysisConfig concurrent = AnalysisConfig.builder().parallel(true).build();

        // When
        AnalysisReport sequential = new AutomationAnalyzer(CATALOG).analyze(automations).getReport();
        AnalysisReport parallel = new AutomationAnalyzer(CATALOG, concurrent).analyze(automations).getReport();

        // Then
        assertThat(parallel).isEqualTo(sequential);
        assertThat(sequential.totalFindings()).isEqualTo(3);
    }

    @Test
    void shouldSkipDisabledPasses() throws Exception {
        // Given
        AnalysisConfig onlyCycles = AnalysisConfig.builder().redundancy(false).inconsistency(false).build();

        // When
        AnalysisReport report = new AutomationAnalyzer(CATALOG, onlyCycles)
            .analyze(fixture("conflicting.yaml")).getReport();

        // Then
        assertThat(report.inconsistency()).isEmpty();
        assertThat(report.summary().events()).isEqualTo(1);
    }

    @Test
    void shouldSerializeInDocumentedShape() throws Exception {
        // Given
        ObjectMapper mapper = new ObjectMapper();
        AnalysisReport report = analyze("circular.yaml");

        // When
        JsonNode json = mapper.readTree(mapper.writeValueAsString(report));

        // Then
        assertThat(json.fieldNames()).toIterable()
            .containsExactly("summary", "redundancy", "inconsistency", "circularity");
        assertThat(json.get("summary").fieldNames()).toIterable().containsExactly(
            "events", "actions", "edges", "redundancy_issues", "inconsistency_issues", "circularity_issues");
        JsonNode cycle = json.get("circularity").get(0);
        assertThat(cycle.fieldNames()).toIterable().containsExactly("cycle_nodes", "size", "issue");
        assertThat(cycle.get("issue").asText()).isEqualTo("Circularity: cycle in event flow graph");
        assertThat(cycle.get("cycle_nodes").asText()).startsWith("E:state(light.l2→on) → ");
    }

    @Test
    void shouldSerializeFindingFieldsInOrder() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode redundancy = mapper.valueToTree(new RedundancyFinding("E:x", "A:y", 2));
        JsonNode inconsistency = mapper.valueToTree(new InconsistencyFinding("E:x", "A:a", "A:b", "light.l1"));

        assertThat(redundancy.fieldNames()).toIterable()
            .containsExactly("event", "action", "paths_count", "issue");
        assertThat(redundancy.get("issue").asText())
            .isEqualTo("Redundancy: action reachable more than once from event");
        assertThat(inconsistency.fieldNames()).toIterable()
            .containsExactly("event", "action1", "action2", "entity", "issue");
        assertThat(inconsistency.get("issue").asText())
            .isEqualTo("Inconsistency: conflicting actions reachable from same event");
    }
}
