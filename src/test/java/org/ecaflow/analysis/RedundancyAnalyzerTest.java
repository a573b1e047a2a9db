package org.ecaflow.analysis;

import org.ecaflow.RuleFixtures;
import org.ecaflow.graph.FlowGraph;
import org.ecaflow.graph.GraphBuilder;
import org.ecaflow.model.Automation;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ecaflow.RuleFixtures.automation;
import static org.ecaflow.RuleFixtures.call;
import static org.ecaflow.RuleFixtures.choose;
import static org.ecaflow.RuleFixtures.state;

class RedundancyAnalyzerTest {

    private final GraphBuilder builder = new GraphBuilder(RuleFixtures.catalog());
    private final RedundancyAnalyzer analyzer = new RedundancyAnalyzer();

    @Test
    void shouldReportActionReachedByTwoBranches() {
        // Given
        FlowGraph graph = builder.build(List.of(automation("Motion music",
            state("binary_sensor.motion_1", "on"),
            choose(List.of(call("media_player.play", "media_player.mp1")),
                   List.of(call("media_player.play", "media_player.mp1"))))));

        // When
        List<RedundancyFinding> findings = analyzer.analyze(graph);

        // Then
        assertThat(findings).containsExactly(new RedundancyFinding(
            "E:state(binary_sensor.motion_1→on)", "A:media_player.play(media_player.mp1=playing)", 2));
    }

    @Test
    void shouldAccumulatePathsAcrossAutomations() {
        // Given
        List<Automation> automations = List.of(
            automation("A1", state("binary_sensor.door", "on"), call("light.turn_on", "light.hall")),
            automation("A2", state("binary_sensor.door", "on"), call("light.turn_on", "light.hall")),
            automation("A3", state("binary_sensor.door", "on"), call("light.turn_on", "light.hall")));

        // When
        List<RedundancyFinding> findings = analyzer.analyze(builder.build(automations));

        // Then
        assertThat(findings).singleElement().extracting(RedundancyFinding::pathsCount).isEqualTo(3);
    }

    @Test
    void shouldReportOnlyPairsWithMoreThanOnePath() {
        // Given
        FlowGraph graph = builder.build(List.of(
            automation("A1", state("binary_sensor.door", "on"),
                call("light.turn_on", "light.hall"),
                call("lock.lock", "lock.front"),
                call("light.turn_on", "light.hall"))));

        // When
        Map<RedundancyAnalyzer.NodePair, Integer> counts = analyzer.pathCounts(graph);
        List<RedundancyFinding> findings = analyzer.analyze(graph);

        // Then
        assertThat(counts.values()).containsExactly(2, 1);
        assertThat(findings).singleElement()
            .extracting(RedundancyFinding::action).isEqualTo("A:light.turn_on(light.hall=on)");
    }
}
