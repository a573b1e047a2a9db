package org.ecaflow.graph;

import org.ecaflow.graph.GraphNode.ActionNode;
import org.ecaflow.graph.GraphNode.EventNode;
import org.ecaflow.model.Action;
import org.ecaflow.model.ServiceCatalog;
import org.ecaflow.model.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Maps triggers to Event nodes and leaf actions to Action nodes.
 *
 * Keys are a pure function of the canonical fields of a trigger or call;
 * the registry turns equal keys into the same vertex. A trigger or call
 * naming several entities yields one node per entity.
 */
public class NodeCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(NodeCanonicalizer.class);

    static final String SCENE_SERVICE = "scene.turn_on";
    static final String EVENT_PREFIX = "event:";
    static final String UNKNOWN_PREFIX = "unknown:";

    private final NodeRegistry registry;
    private final ServiceCatalog catalog;
    private final Consumer<BuildDiagnostic> diagnostics;
    private final Set<String> reportedSignatures;

    public NodeCanonicalizer(NodeRegistry registry, ServiceCatalog catalog,
                             Consumer<BuildDiagnostic> diagnostics) {
        this.registry = registry;
        this.catalog = catalog;
        this.diagnostics = diagnostics;
        this.reportedSignatures = new HashSet<>();
    }

    // ========================================================================
    // Events
    // ========================================================================

    /**
     * Event nodes for one trigger, registering any not seen before.
     */
    public List<EventNode> eventNodes(String automationId, Trigger trigger) {
        if (trigger instanceof Trigger.UnknownTrigger unknown) {
            diagnostics.accept(new BuildDiagnostic.UnknownTriggerKind(automationId, unknown.platform()));
        }
        List<EventNode> nodes = new ArrayList<>();
        for (EventKey key : eventKeys(trigger)) {
            nodes.add(registry.event(key));
        }
        return nodes;
    }

    /**
     * Canonical keys for a trigger. Identity fields per platform:
     * state: entity, {@code to}, attribute ({@code from} and {@code for} excluded);
     * other platforms: their primary field plus discriminating parameters.
     */
    public static List<EventKey> eventKeys(Trigger trigger) {
        List<EventKey> keys = new ArrayList<>();

        if (trigger instanceof Trigger.StateTrigger t) {
            SortedMap<String, String> params = params("attribute", t.attribute());
            for (String entity : orNull(t.entityIds())) {
                for (String to : orNull(t.toStates())) {
                    keys.add(new EventKey(t.platform(), entity, to, params));
                }
            }
        } else if (trigger instanceof Trigger.NumericStateTrigger t) {
            SortedMap<String, String> params = params(
                "above", t.above(), "below", t.below(), "attribute", t.attribute());
            for (String entity : orNull(t.entityIds())) {
                keys.add(new EventKey(t.platform(), entity, null, params));
            }
        } else if (trigger instanceof Trigger.ZoneTrigger t) {
            SortedMap<String, String> params = params("event", t.event());
            for (String entity : orNull(t.entityIds())) {
                keys.add(new EventKey(t.platform(), entity, t.zone(), params));
            }
        } else if (trigger instanceof Trigger.TimeTrigger t) {
            for (String at : orNull(t.at())) {
                keys.add(EventKey.of(t.platform(), at, null));
            }
        } else if (trigger instanceof Trigger.TimePatternTrigger t) {
            keys.add(new EventKey(t.platform(), null, null, params(
                "hours", t.hours(), "minutes", t.minutes(), "seconds", t.seconds())));
        } else if (trigger instanceof Trigger.SunTrigger t) {
            keys.add(new EventKey(t.platform(), t.event(), null, params("offset", t.offset())));
        } else if (trigger instanceof Trigger.CalendarTrigger t) {
            keys.add(new EventKey(t.platform(), t.entityId(), null, params(
                "event", t.event(), "offset", t.offset())));
        } else if (trigger instanceof Trigger.EventTrigger t) {
            String data = t.eventData().isEmpty() ? null : canonicalText(t.eventData());
            for (String type : orNull(t.eventTypes())) {
                keys.add(new EventKey(t.platform(), type, null, params("event_data", data)));
            }
        } else if (trigger instanceof Trigger.MqttTrigger t) {
            keys.add(new EventKey(t.platform(), t.topic(), null, params("payload", t.payload())));
        } else if (trigger instanceof Trigger.WebhookTrigger t) {
            keys.add(EventKey.of(t.platform(), t.webhookId(), null));
        } else if (trigger instanceof Trigger.TemplateTrigger t) {
            keys.add(EventKey.of(t.platform(), t.valueTemplate(), null));
        } else if (trigger instanceof Trigger.HomeAssistantTrigger t) {
            keys.add(EventKey.of(t.platform(), t.event(), null));
        } else if (trigger instanceof Trigger.DeviceTrigger t) {
            keys.add(new EventKey(t.platform(), t.deviceId(), null, params(
                "domain", t.domain(), "type", t.type(), "entity_id", t.entityId(), "subtype", t.subtype())));
        } else if (trigger instanceof Trigger.TagTrigger t) {
            for (String tag : orNull(t.tagIds())) {
                keys.add(EventKey.of(t.platform(), tag, null));
            }
        } else if (trigger instanceof Trigger.UnknownTrigger t) {
            keys.add(new EventKey(t.platform(), null, null, new TreeMap<>(t.parameters())));
        } else {
            throw new IllegalStateException("Unhandled trigger type: " + trigger.getClass().getName());
        }

        return keys;
    }

    // ========================================================================
    // Actions
    // ========================================================================

    /**
     * Action nodes for one leaf action, registering any not seen before.
     * Records a {@link BuildDiagnostic.MissingCatalogEntry} the first time an
     * uncataloged signature is seen.
     */
    public List<ActionNode> actionNodes(String automationId, Action leaf) {
        List<ActionNode> nodes = new ArrayList<>();
        for (ActionKey key : actionKeys(leaf)) {
            if (key.resultingState() == null && !key.signature().startsWith(UNKNOWN_PREFIX)
                    && reportedSignatures.add(key.signature())) {
                diagnostics.accept(new BuildDiagnostic.MissingCatalogEntry(automationId, key.signature()));
            }
            if (!registry.containsAction(key)) {
                log.debug("New action node {} from '{}'", key.label(), automationId);
            }
            nodes.add(registry.action(key));
        }
        return nodes;
    }

    /**
     * Node for a pass-through step ({@code delay}, {@code wait_*},
     * {@code variables}) when the catalog gives that step type a state effect.
     */
    public Optional<ActionNode> passThroughNode(Action step) {
        String signature = step.actionType();
        return catalog.effectOf(signature)
            .map(state -> registry.action(new ActionKey(signature, null, state)));
    }

    /**
     * Canonical keys for a leaf action. Control structures and pass-through
     * steps have no keys of their own.
     */
    public List<ActionKey> actionKeys(Action leaf) {
        List<ActionKey> keys = new ArrayList<>();

        if (leaf instanceof Action.ServiceCall call) {
            String signature = qualify(call.service(), call.data());
            String state = catalog.effectOf(signature).orElse(null);
            for (String entity : orNull(call.entityIds())) {
                keys.add(new ActionKey(signature, entity, state));
            }
        } else if (leaf instanceof Action.DeviceAction device) {
            String signature = device.domain() != null && device.type() != null
                ? device.domain() + "." + device.type()
                : "device";
            String entity = device.entityId() != null ? device.entityId() : device.deviceId();
            keys.add(new ActionKey(signature, entity, catalog.effectOf(signature).orElse(null)));
        } else if (leaf instanceof Action.FireEvent fire) {
            String signature = EVENT_PREFIX + fire.eventType();
            keys.add(new ActionKey(signature, null, catalog.effectOf(signature).orElse(null)));
        } else if (leaf instanceof Action.SceneActivation scene) {
            keys.add(new ActionKey(SCENE_SERVICE, scene.sceneEntityId(),
                catalog.effectOf(SCENE_SERVICE).orElse(null)));
        } else if (leaf instanceof Action.UnknownAction unknown) {
            keys.add(new ActionKey(UNKNOWN_PREFIX + unknown.actionType(), null, null));
        } else {
            throw new IllegalArgumentException("Not a leaf action: " + leaf.actionType());
        }

        return keys;
    }

    /**
     * Signature of a service call, refined by the catalog's qualifier field
     * when the call data carries it ({@code climate.set_hvac_mode:cool}).
     */
    String qualify(String service, Map<String, Object> data) {
        Optional<String> field = catalog.qualifierFieldFor(service);
        if (field.isPresent()) {
            Object value = data.get(field.get());
            if (value != null) {
                return service + ServiceCatalog.QUALIFIER_SEPARATOR + canonicalText(value);
            }
        }
        return service;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Order-independent text for a decoded YAML value: mappings are sorted
     * by key, so equal content always renders the same.
     */
    public static String canonicalText(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .map(e -> String.valueOf(e.getKey()) + "=" + canonicalText(e.getValue()))
                .sorted()
                .collect(Collectors.joining(", ", "{", "}"));
        }
        if (value instanceof Collection<?> items) {
            return items.stream()
                .map(NodeCanonicalizer::canonicalText)
                .collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }

    private static SortedMap<String, String> params(String... namesAndValues) {
        SortedMap<String, String> params = new TreeMap<>();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            if (namesAndValues[i + 1] != null) {
                params.put(namesAndValues[i], namesAndValues[i + 1]);
            }
        }
        return params;
    }

    /**
     * The list itself, or a single null when it is empty ("unspecified").
     */
    private static List<String> orNull(List<String> values) {
        return values.isEmpty() ? Collections.singletonList(null) : values;
    }
}
