package org.ecaflow.graph;

import org.ecaflow.RuleFixtures;
import org.ecaflow.graph.RuleFlattener.FlattenedRule;
import org.ecaflow.model.Action;
import org.ecaflow.model.Automation;
import org.ecaflow.model.Condition;
import org.ecaflow.model.ServiceCatalog;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ecaflow.RuleFixtures.call;
import static org.ecaflow.RuleFixtures.choose;
import static org.ecaflow.RuleFixtures.state;

class RuleFlattenerTest {

    private static final String ON = "A:light.turn_on(light.a=on)";
    private static final String OFF = "A:light.turn_off(light.a=off)";
    private static final String LOCK = "A:lock.lock(lock.front=locked)";

    private final List<BuildDiagnostic> diagnostics = new ArrayList<>();

    private RuleFlattener flattener(ServiceCatalog catalog) {
        NodeCanonicalizer canonicalizer = new NodeCanonicalizer(new NodeRegistry(), catalog, diagnostics::add);
        return new RuleFlattener(canonicalizer, diagnostics::add);
    }

    private List<String> paths(Action... actions) {
        return paths(RuleFixtures.catalog(), actions);
    }

    private List<String> paths(ServiceCatalog catalog, Action... actions) {
        Automation automation = RuleFixtures.automation("a1", state("binary_sensor.s", "on"), actions);
        FlattenedRule rule = flattener(catalog).flatten(automation);
        return rule.actionPaths().stream().map(GraphNode::label).toList();
    }

    @Test
    void shouldCountEachBranchOccurrenceAsOnePath() {
        // When
        List<String> paths = paths(
            choose(List.of(call("light.turn_on", "light.a")), List.of(call("light.turn_on", "light.a"))),
            call("lock.lock", "lock.front"));

        // Then: the step after the choose is reached once, not once per branch
        assertThat(paths).containsExactly(ON, ON, LOCK);
    }

    @Test
    void shouldReachNothingWhenStopComesFirst() {
        List<String> paths = paths(new Action.Stop("halt", false), call("light.turn_on", "light.a"));

        assertThat(paths).isEmpty();
    }

    @Test
    void shouldContinuePastIfWithoutElseEvenWhenThenStops() {
        // Given
        Action conditional = new Action.If(List.of(),
            List.of(call("light.turn_on", "light.a"), new Action.Stop(null, false)), null);

        // When
        List<String> paths = paths(conditional, call("lock.lock", "lock.front"));

        // Then
        assertThat(paths).containsExactly(ON, LOCK);
    }

    @Test
    void shouldHaltAfterIfWhenBothBranchesStop() {
        // Given
        Action conditional = new Action.If(List.of(),
            List.of(call("light.turn_on", "light.a"), new Action.Stop(null, false)),
            List.of(call("light.turn_off", "light.a"), new Action.Stop(null, true)));

        // When
        List<String> paths = paths(conditional, call("lock.lock", "lock.front"));

        // Then
        assertThat(paths).containsExactly(ON, OFF);
    }

    @Test
    void shouldHaltAfterChooseOnlyWhenDefaultAndAllOptionsStop() {
        // Given
        List<Action> stopping = List.of(call("light.turn_on", "light.a"), new Action.Stop(null, false));
        Action withDefault = new Action.Choose(
            List.of(new Action.ChooseOption(List.of(), stopping)), List.of(new Action.Stop(null, false)));
        Action withoutDefault = new Action.Choose(
            List.of(new Action.ChooseOption(List.of(), stopping)), null);

        // Then
        assertThat(paths(withDefault, call("lock.lock", "lock.front"))).containsExactly(ON);
        assertThat(paths(withoutDefault, call("lock.lock", "lock.front"))).containsExactly(ON, LOCK);
    }

    @Test
    void shouldContinuePastParallelOnlyWhenEveryBranchContinues() {
        // Given
        Action oneStops = new Action.Parallel(List.of(
            List.of(call("light.turn_on", "light.a")),
            List.of(new Action.Stop(null, false))));
        Action noneStops = new Action.Parallel(List.of(
            List.of(call("light.turn_on", "light.a")),
            List.of(call("light.turn_off", "light.a"))));

        // Then
        assertThat(paths(oneStops, call("lock.lock", "lock.front"))).containsExactly(ON);
        assertThat(paths(noneStops, call("lock.lock", "lock.front"))).containsExactly(ON, OFF, LOCK);
    }

    @Test
    void shouldFlattenRepeatBodyOnce() {
        Action repeat = new Action.Repeat(Action.RepeatMode.COUNT, List.of(call("light.turn_on", "light.a")));

        assertThat(paths(repeat)).containsExactly(ON);
    }

    @Test
    void shouldSkipPassThroughStepsUnlessCataloged() {
        // Given
        ServiceCatalog withDelayEffect = RuleFixtures.catalog().toBuilder().effect("delay", "waited").build();
        Action[] steps = {new Action.Delay("00:00:05"), call("light.turn_on", "light.a")};

        // Then
        assertThat(paths(steps)).containsExactly(ON);
        assertThat(paths(withDelayEffect, steps)).containsExactly("A:delay", ON);
    }

    @Test
    void shouldTreatEmptyStructuresAsMalformed() {
        // When
        List<String> paths = paths(
            new Action.Choose(List.of(), List.of(call("light.turn_off", "light.a"))),
            new Action.Parallel(List.of()),
            new Action.Repeat(Action.RepeatMode.WHILE, List.of()),
            call("light.turn_on", "light.a"));

        // Then
        assertThat(paths).containsExactly(ON);
        assertThat(diagnostics).containsExactly(
            new BuildDiagnostic.MalformedRuleStructure("a1", "choose", "no options"),
            new BuildDiagnostic.MalformedRuleStructure("a1", "parallel", "no branches"),
            new BuildDiagnostic.MalformedRuleStructure("a1", "repeat", "empty sequence"));
    }

    @Test
    void shouldKeepUnknownStepsAsOpaquePaths() {
        // When
        List<String> paths = paths(
            new Action.ConditionStep(new Condition.UnknownCondition("device", Map.of())),
            new Action.UnknownAction("set_conversation_response", Map.of()));

        // Then
        assertThat(paths).containsExactly("A:unknown:set_conversation_response");
        assertThat(diagnostics).containsExactly(
            new BuildDiagnostic.UnknownConditionKind("a1", "device"),
            new BuildDiagnostic.UnknownActionKind("a1", "set_conversation_response"));
    }

    @Test
    void shouldKeepDuplicateTriggers() {
        // Given
        Automation automation = new Automation("a1",
            List.of(state("binary_sensor.s", "on"), state("binary_sensor.s", "on")),
            List.of(), List.of(call("light.turn_on", "light.a")));

        // When
        FlattenedRule rule = flattener(RuleFixtures.catalog()).flatten(automation);

        // Then
        assertThat(rule.events()).hasSize(2);
        assertThat(rule.events().get(0)).isSameAs(rule.events().get(1));
    }
}
