package org.ecaflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of an automation's action tree.
 *
 * Three groups of variants:
 * - leaves that change something ({@link ServiceCall}, {@link DeviceAction},
 *   {@link FireEvent}, {@link SceneActivation})
 * - pass-through steps that only affect timing or scope
 * - control structures that group or select nested sequences
 */
public sealed interface Action permits
        Action.ServiceCall,
        Action.DeviceAction,
        Action.FireEvent,
        Action.SceneActivation,
        Action.Delay,
        Action.WaitTemplate,
        Action.WaitForTrigger,
        Action.Variables,
        Action.ConditionStep,
        Action.Choose,
        Action.If,
        Action.Parallel,
        Action.Sequence,
        Action.Repeat,
        Action.Stop,
        Action.UnknownAction {

    String actionType();

    // ========================================================================
    // Leaf Actions
    // ========================================================================

    /**
     * Service call such as {@code light.turn_on}. {@code data} holds the call
     * data ({@code data:} merged over legacy {@code data_template:}).
     */
    record ServiceCall(
            String service,
            List<String> entityIds,
            Map<String, Object> data
    ) implements Action {
        public ServiceCall {
            entityIds = List.copyOf(entityIds);
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }

        public String actionType() { return "service"; }
    }

    record DeviceAction(
            String deviceId,
            String domain,
            String type,
            String entityId
    ) implements Action {
        public String actionType() { return "device"; }
    }

    record FireEvent(String eventType, Map<String, Object> eventData) implements Action {
        public FireEvent {
            eventData = Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
        }

        public String actionType() { return "event"; }
    }

    /**
     * {@code scene: scene.x} shorthand, equivalent to {@code scene.turn_on} on that entity.
     */
    record SceneActivation(String sceneEntityId) implements Action {
        public String actionType() { return "scene"; }
    }

    // ========================================================================
    // Pass-through Steps
    // ========================================================================

    record Delay(String duration) implements Action {
        public String actionType() { return "delay"; }
    }

    record WaitTemplate(String template, String timeout) implements Action {
        public String actionType() { return "wait_template"; }
    }

    record WaitForTrigger(List<Trigger> triggers, String timeout) implements Action {
        public WaitForTrigger {
            triggers = List.copyOf(triggers);
        }

        public String actionType() { return "wait_for_trigger"; }
    }

    record Variables(Map<String, Object> variables) implements Action {
        public Variables {
            variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }

        public String actionType() { return "variables"; }
    }

    /**
     * Inline condition in a sequence; halts the run when false.
     */
    record ConditionStep(Condition condition) implements Action {
        public String actionType() { return "condition"; }
    }

    // ========================================================================
    // Control Structures
    // ========================================================================

    record ChooseOption(List<Condition> conditions, List<Action> sequence) {
        public ChooseOption {
            conditions = List.copyOf(conditions);
            sequence = List.copyOf(sequence);
        }
    }

    /**
     * Guarded alternatives. {@code defaultSequence} is null when no default is given.
     */
    record Choose(List<ChooseOption> options, List<Action> defaultSequence) implements Action {
        public Choose {
            options = List.copyOf(options);
            defaultSequence = defaultSequence != null ? List.copyOf(defaultSequence) : null;
        }

        public boolean hasDefault() { return defaultSequence != null; }

        public String actionType() { return "choose"; }
    }

    /**
     * Conditional block. {@code elseSequence} is null when no {@code else} is given.
     */
    record If(
            List<Condition> conditions,
            List<Action> thenSequence,
            List<Action> elseSequence
    ) implements Action {
        public If {
            conditions = List.copyOf(conditions);
            thenSequence = List.copyOf(thenSequence);
            elseSequence = elseSequence != null ? List.copyOf(elseSequence) : null;
        }

        public boolean hasElse() { return elseSequence != null; }

        public String actionType() { return "if"; }
    }

    record Parallel(List<List<Action>> branches) implements Action {
        public Parallel {
            branches = branches.stream().map(List::copyOf).toList();
        }

        public String actionType() { return "parallel"; }
    }

    record Sequence(List<Action> steps) implements Action {
        public Sequence {
            steps = List.copyOf(steps);
        }

        public String actionType() { return "sequence"; }
    }

    enum RepeatMode {
        COUNT,
        WHILE,
        UNTIL,
        FOR_EACH
    }

    record Repeat(RepeatMode mode, List<Action> sequence) implements Action {
        public Repeat {
            sequence = List.copyOf(sequence);
        }

        public String actionType() { return "repeat"; }
    }

    record Stop(String reason, boolean error) implements Action {
        public String actionType() { return "stop"; }
    }

    // ========================================================================
    // Fallback
    // ========================================================================

    /**
     * Step whose kind this analyzer does not model. {@code actionType} is the
     * first key of the step mapping.
     */
    record UnknownAction(String actionType, Map<String, String> parameters) implements Action {
        public UnknownAction {
            parameters = Map.copyOf(parameters);
        }
    }
}
