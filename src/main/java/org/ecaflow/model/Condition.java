package org.ecaflow.model;

import java.util.List;
import java.util.Map;

/**
 * Guard of an automation, a {@code choose} option, or an {@code if} block.
 *
 * Conditions are parsed and kept on the model but never evaluated: the
 * flow graph assumes every guarded branch can run.
 */
public sealed interface Condition permits
        Condition.And,
        Condition.Or,
        Condition.Not,
        Condition.StateCondition,
        Condition.NumericStateCondition,
        Condition.TemplateCondition,
        Condition.TimeCondition,
        Condition.SunCondition,
        Condition.ZoneCondition,
        Condition.TriggerCondition,
        Condition.UnknownCondition {

    String conditionType();

    // ========================================================================
    // Logical
    // ========================================================================

    record And(List<Condition> conditions) implements Condition {
        public And {
            conditions = List.copyOf(conditions);
        }

        public String conditionType() { return "and"; }
    }

    record Or(List<Condition> conditions) implements Condition {
        public Or {
            conditions = List.copyOf(conditions);
        }

        public String conditionType() { return "or"; }
    }

    record Not(List<Condition> conditions) implements Condition {
        public Not {
            conditions = List.copyOf(conditions);
        }

        public String conditionType() { return "not"; }
    }

    // ========================================================================
    // Entity
    // ========================================================================

    record StateCondition(
            List<String> entityIds,
            List<String> states,
            String attribute
    ) implements Condition {
        public StateCondition {
            entityIds = List.copyOf(entityIds);
            states = List.copyOf(states);
        }

        public String conditionType() { return "state"; }
    }

    record NumericStateCondition(
            List<String> entityIds,
            String above,
            String below
    ) implements Condition {
        public NumericStateCondition {
            entityIds = List.copyOf(entityIds);
        }

        public String conditionType() { return "numeric_state"; }
    }

    record ZoneCondition(List<String> entityIds, String zone) implements Condition {
        public ZoneCondition {
            entityIds = List.copyOf(entityIds);
        }

        public String conditionType() { return "zone"; }
    }

    // ========================================================================
    // Time, Template, Trigger
    // ========================================================================

    record TemplateCondition(String valueTemplate) implements Condition {
        public String conditionType() { return "template"; }
    }

    record TimeCondition(
            String after,
            String before,
            List<String> weekdays
    ) implements Condition {
        public TimeCondition {
            weekdays = List.copyOf(weekdays);
        }

        public String conditionType() { return "time"; }
    }

    record SunCondition(String after, String before) implements Condition {
        public String conditionType() { return "sun"; }
    }

    /**
     * Matches on the id of the trigger that started the run.
     */
    record TriggerCondition(List<String> ids) implements Condition {
        public TriggerCondition {
            ids = List.copyOf(ids);
        }

        public String conditionType() { return "trigger"; }
    }

    record UnknownCondition(String conditionType, Map<String, String> parameters) implements Condition {
        public UnknownCondition {
            parameters = Map.copyOf(parameters);
        }
    }
}
