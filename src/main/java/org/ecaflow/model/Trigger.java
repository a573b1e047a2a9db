package org.ecaflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trigger of an automation: the event that starts its action sequence.
 *
 * One record per supported trigger platform. Platforms outside this set
 * are kept as {@link UnknownTrigger} so they still become graph nodes.
 */
public sealed interface Trigger permits
        Trigger.StateTrigger,
        Trigger.NumericStateTrigger,
        Trigger.TimeTrigger,
        Trigger.TimePatternTrigger,
        Trigger.SunTrigger,
        Trigger.EventTrigger,
        Trigger.MqttTrigger,
        Trigger.WebhookTrigger,
        Trigger.ZoneTrigger,
        Trigger.TemplateTrigger,
        Trigger.HomeAssistantTrigger,
        Trigger.DeviceTrigger,
        Trigger.TagTrigger,
        Trigger.CalendarTrigger,
        Trigger.UnknownTrigger {

    /**
     * Platform name as written in the rule ({@code platform:} or {@code trigger:}).
     */
    String platform();

    // ========================================================================
    // Entity State Triggers
    // ========================================================================

    /**
     * Entity state change. An empty {@code toStates} list means "any state".
     */
    record StateTrigger(
            List<String> entityIds,
            List<String> toStates,
            String fromState,
            String attribute,
            String forDuration
    ) implements Trigger {
        public StateTrigger {
            entityIds = List.copyOf(entityIds);
            toStates = List.copyOf(toStates);
        }

        public String platform() { return "state"; }
    }

    record NumericStateTrigger(
            List<String> entityIds,
            String above,
            String below,
            String attribute
    ) implements Trigger {
        public NumericStateTrigger {
            entityIds = List.copyOf(entityIds);
        }

        public String platform() { return "numeric_state"; }
    }

    record ZoneTrigger(
            List<String> entityIds,
            String zone,
            String event
    ) implements Trigger {
        public ZoneTrigger {
            entityIds = List.copyOf(entityIds);
        }

        public String platform() { return "zone"; }
    }

    // ========================================================================
    // Time Triggers
    // ========================================================================

    record TimeTrigger(List<String> at) implements Trigger {
        public TimeTrigger {
            at = List.copyOf(at);
        }

        public String platform() { return "time"; }
    }

    record TimePatternTrigger(
            String hours,
            String minutes,
            String seconds
    ) implements Trigger {
        public String platform() { return "time_pattern"; }
    }

    record SunTrigger(String event, String offset) implements Trigger {
        public String platform() { return "sun"; }
    }

    record CalendarTrigger(
            String entityId,
            String event,
            String offset
    ) implements Trigger {
        public String platform() { return "calendar"; }
    }

    // ========================================================================
    // External and Bus Triggers
    // ========================================================================

    record EventTrigger(
            List<String> eventTypes,
            Map<String, Object> eventData
    ) implements Trigger {
        public EventTrigger {
            eventTypes = List.copyOf(eventTypes);
            eventData = Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
        }

        public String platform() { return "event"; }
    }

    record MqttTrigger(String topic, String payload) implements Trigger {
        public String platform() { return "mqtt"; }
    }

    record WebhookTrigger(String webhookId) implements Trigger {
        public String platform() { return "webhook"; }
    }

    record TemplateTrigger(String valueTemplate) implements Trigger {
        public String platform() { return "template"; }
    }

    /**
     * Home Assistant lifecycle ({@code start} / {@code shutdown}).
     */
    record HomeAssistantTrigger(String event) implements Trigger {
        public String platform() { return "homeassistant"; }
    }

    record DeviceTrigger(
            String deviceId,
            String domain,
            String type,
            String entityId,
            String subtype
    ) implements Trigger {
        public String platform() { return "device"; }
    }

    record TagTrigger(List<String> tagIds) implements Trigger {
        public TagTrigger {
            tagIds = List.copyOf(tagIds);
        }

        public String platform() { return "tag"; }
    }

    // ========================================================================
    // Fallback
    // ========================================================================

    /**
     * Trigger on a platform this analyzer does not model. The scalar
     * parameters are kept so distinct unknown triggers stay distinct.
     */
    record UnknownTrigger(String platform, Map<String, String> parameters) implements Trigger {
        public UnknownTrigger {
            parameters = Map.copyOf(parameters);
        }
    }
}
