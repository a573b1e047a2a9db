package org.ecaflow.graph;

import org.ecaflow.graph.GraphNode.ActionNode;
import org.ecaflow.graph.GraphNode.EventNode;
import org.ecaflow.model.Action;
import org.ecaflow.model.Automation;
import org.ecaflow.model.Condition;
import org.ecaflow.model.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;

/**
 * Walks one automation's action tree and lists the leaf actions reachable
 * from its triggers.
 *
 * Guards are never evaluated: every alternative of a {@code choose} or
 * {@code if} is taken as possible. Each leaf occurrence reached is one path,
 * so an action appearing in two branches is listed twice.
 */
public class RuleFlattener {

    private static final Logger log = LoggerFactory.getLogger(RuleFlattener.class);

    private final NodeCanonicalizer canonicalizer;
    private final Consumer<BuildDiagnostic> diagnostics;

    public RuleFlattener(NodeCanonicalizer canonicalizer, Consumer<BuildDiagnostic> diagnostics) {
        this.canonicalizer = canonicalizer;
        this.diagnostics = diagnostics;
    }

    // ========================================================================
    // Result Types
    // ========================================================================

    /**
     * Flattened form of one automation.
     *
     * @param automationId source automation
     * @param events       one entry per trigger expansion, duplicates kept
     * @param actionPaths  one entry per path reaching a leaf, in tree order
     */
    public record FlattenedRule(
            String automationId,
            List<EventNode> events,
            List<ActionNode> actionPaths
    ) {
        public FlattenedRule {
            events = List.copyOf(events);
            actionPaths = List.copyOf(actionPaths);
        }

        public boolean isEmpty() {
            return events.isEmpty() || actionPaths.isEmpty();
        }
    }

    /**
     * Paths reached by a step or sequence, and whether control can continue
     * to the step that follows it.
     */
    record Reach(List<ActionNode> paths, boolean fallsThrough) {
        static final Reach NOTHING = new Reach(List.of(), true);
        static final Reach HALT = new Reach(List.of(), false);

        static Reach of(List<ActionNode> paths) {
            return new Reach(paths, true);
        }
    }

    // ========================================================================
    // Flattening
    // ========================================================================

    public FlattenedRule flatten(Automation automation) {
        String id = automation.id();

        List<EventNode> events = new ArrayList<>();
        for (Trigger trigger : automation.triggers()) {
            events.addAll(canonicalizer.eventNodes(id, trigger));
        }
        inspectConditions(id, automation.conditions());

        Reach reach = flattenSequence(id, automation.actions());
        log.debug("Flattened '{}': {} event(s), {} path(s)", id, events.size(), reach.paths().size());
        return new FlattenedRule(id, events, reach.paths());
    }

    Reach flattenSequence(String automationId, List<Action> steps) {
        List<ActionNode> paths = new ArrayList<>();
        boolean fallsThrough = true;
        for (int i = 0; i < steps.size(); i++) {
            if (!fallsThrough) {
                log.debug("'{}': {} step(s) after a stop are unreachable", automationId, steps.size() - i);
                break;
            }
            Reach reach = flattenStep(automationId, steps.get(i));
            paths.addAll(reach.paths());
            fallsThrough = reach.fallsThrough();
        }
        return new Reach(paths, fallsThrough);
    }

    Reach flattenStep(String automationId, Action step) {
        // Leaves
        if (step instanceof Action.ServiceCall
                || step instanceof Action.DeviceAction
                || step instanceof Action.FireEvent
                || step instanceof Action.SceneActivation) {
            return Reach.of(new ArrayList<>(canonicalizer.actionNodes(automationId, step)));
        }
        if (step instanceof Action.UnknownAction unknown) {
            diagnostics.accept(new BuildDiagnostic.UnknownActionKind(automationId, unknown.actionType()));
            return Reach.of(new ArrayList<>(canonicalizer.actionNodes(automationId, step)));
        }

        // Pass-through
        if (step instanceof Action.ConditionStep conditionStep) {
            inspectCondition(automationId, conditionStep.condition());
            return Reach.NOTHING;
        }
        if (step instanceof Action.Delay
                || step instanceof Action.WaitTemplate
                || step instanceof Action.WaitForTrigger
                || step instanceof Action.Variables) {
            return canonicalizer.passThroughNode(step)
                .map(node -> Reach.of(List.of(node)))
                .orElse(Reach.NOTHING);
        }

        // Control structures
        if (step instanceof Action.Choose choose) {
            return flattenChoose(automationId, choose);
        }
        if (step instanceof Action.If conditional) {
            return flattenIf(automationId, conditional);
        }
        if (step instanceof Action.Parallel parallel) {
            if (parallel.branches().isEmpty()) {
                return malformed(automationId, "parallel", "no branches");
            }
            List<Reach> branches = takeAllBranches(automationId, parallel.branches());
            boolean fallsThrough = branches.stream().allMatch(Reach::fallsThrough);
            return new Reach(union(branches), fallsThrough);
        }
        if (step instanceof Action.Sequence sequence) {
            return flattenSequence(automationId, sequence.steps());
        }
        if (step instanceof Action.Repeat repeat) {
            if (repeat.sequence().isEmpty()) {
                return malformed(automationId, "repeat", "empty sequence");
            }
            // one iteration, no unrolling
            return flattenSequence(automationId, repeat.sequence());
        }
        if (step instanceof Action.Stop) {
            return Reach.HALT;
        }

        throw new IllegalStateException("Unhandled action type: " + step.actionType());
    }

    private Reach flattenChoose(String automationId, Action.Choose choose) {
        if (choose.options().isEmpty()) {
            return malformed(automationId, "choose", "no options");
        }
        List<List<Action>> alternatives = new ArrayList<>();
        for (Action.ChooseOption option : choose.options()) {
            inspectConditions(automationId, option.conditions());
            alternatives.add(option.sequence());
        }
        if (choose.hasDefault()) {
            alternatives.add(choose.defaultSequence());
        }

        List<Reach> branches = takeAllBranches(automationId, alternatives);
        boolean fallsThrough = !choose.hasDefault() || branches.stream().anyMatch(Reach::fallsThrough);
        return new Reach(union(branches), fallsThrough);
    }

    private Reach flattenIf(String automationId, Action.If conditional) {
        if (conditional.thenSequence().isEmpty()) {
            return malformed(automationId, "if", "empty then");
        }
        inspectConditions(automationId, conditional.conditions());

        List<List<Action>> alternatives = new ArrayList<>();
        alternatives.add(conditional.thenSequence());
        if (conditional.hasElse()) {
            alternatives.add(conditional.elseSequence());
        }

        List<Reach> branches = takeAllBranches(automationId, alternatives);
        boolean fallsThrough = !conditional.hasElse() || branches.stream().anyMatch(Reach::fallsThrough);
        return new Reach(union(branches), fallsThrough);
    }

    /**
     * Every alternative is flattened on its own and all of them count as
     * reachable.
     */
    List<Reach> takeAllBranches(String automationId, List<List<Action>> alternatives) {
        List<Reach> reaches = new ArrayList<>(alternatives.size());
        for (List<Action> alternative : alternatives) {
            reaches.add(flattenSequence(automationId, alternative));
        }
        return reaches;
    }

    private static List<ActionNode> union(List<Reach> branches) {
        List<ActionNode> paths = new ArrayList<>();
        for (Reach branch : branches) {
            paths.addAll(branch.paths());
        }
        return paths;
    }

    private Reach malformed(String automationId, String structure, String detail) {
        diagnostics.accept(new BuildDiagnostic.MalformedRuleStructure(automationId, structure, detail));
        return Reach.NOTHING;
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    private void inspectConditions(String automationId, List<Condition> conditions) {
        for (Condition condition : conditions) {
            inspectCondition(automationId, condition);
        }
    }

    private void inspectCondition(String automationId, Condition condition) {
        if (condition instanceof Condition.UnknownCondition unknown) {
            diagnostics.accept(new BuildDiagnostic.UnknownConditionKind(automationId, unknown.conditionType()));
        } else if (condition instanceof Condition.And and) {
            inspectConditions(automationId, and.conditions());
        } else if (condition instanceof Condition.Or or) {
            inspectConditions(automationId, or.conditions());
        } else if (condition instanceof Condition.Not not) {
            inspectConditions(automationId, not.conditions());
        }
    }
}
