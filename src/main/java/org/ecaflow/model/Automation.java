package org.ecaflow.model;

import java.util.List;

/**
 * A single Event-Condition-Action rule.
 *
 * @param id         display identifier (alias, id, description or positional fallback)
 * @param triggers   enabled triggers, in document order
 * @param conditions top-level conditions (kept, never evaluated)
 * @param actions    root action sequence
 */
public record Automation(
        String id,
        List<Trigger> triggers,
        List<Condition> conditions,
        List<Action> actions
) {
    public Automation {
        triggers = List.copyOf(triggers);
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
    }

    public boolean hasTriggers() {
        return !triggers.isEmpty();
    }

    public boolean hasActions() {
        return !actions.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Automation[id=%s, triggers=%d, conditions=%d, actions=%d]",
            id, triggers.size(), conditions.size(), actions.size());
    }
}
