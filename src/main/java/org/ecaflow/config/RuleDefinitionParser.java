package org.ecaflow.config;

import org.ecaflow.graph.NodeCanonicalizer;
import org.ecaflow.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns decoded automation mappings into the typed rule model.
 *
 * Parsing is lenient: unrecognized trigger, condition and action kinds map to
 * their {@code Unknown*} variants, items with {@code enabled: false} are
 * dropped, and entries that are not mappings are skipped with a warning.
 *
 * Scalars are normalized to text the way Home Assistant reads them:
 * YAML booleans become {@code on}/{@code off}, and clock times in time fields
 * ({@code at: 7:30}, {@code at: '07:30:00'}) become {@code HH:MM:SS}.
 */
public class RuleDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(RuleDefinitionParser.class);

    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d{1,2}):(\\d{2})(?::(\\d{2}))?");

    /** Keys that never identify a trigger. */
    private static final Set<String> TRIGGER_META_KEYS = Set.of(
        "platform", "trigger", "id", "alias", "enabled", "variables");

    // ========================================================================
    // Automations
    // ========================================================================

    /**
     * Parse a list of raw automation entries; positions are used for naming
     * automations that carry no alias, id or description.
     */
    public List<Automation> parseAutomations(List<?> entries) {
        List<Automation> automations = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (!(entry instanceof Map<?, ?>)) {
                log.warn("Skipping automation entry {}: not a mapping ({})", i + 1, typeName(entry));
                continue;
            }
            automations.add(parseAutomation(asMap(entry), i + 1));
        }
        log.info("Parsed {} automation(s)", automations.size());
        return automations;
    }

    /**
     * @param position 1-based position, used for the {@code rule_<n>} fallback name
     */
    public Automation parseAutomation(Map<String, Object> raw, int position) {
        String id = getString(raw, "alias");
        if (id == null) id = getString(raw, "id");
        if (id == null) id = getString(raw, "description");
        if (id == null) id = "rule_" + position;

        List<Trigger> triggers = parseTriggers(first(raw, "trigger", "triggers"));
        List<Condition> conditions = parseConditions(first(raw, "condition", "conditions"));
        List<Action> actions = parseSequence(first(raw, "action", "actions", "sequence"));

        return new Automation(id, triggers, conditions, actions);
    }

    // ========================================================================
    // Triggers
    // ========================================================================

    public List<Trigger> parseTriggers(Object raw) {
        List<Trigger> triggers = new ArrayList<>();
        for (Map<String, Object> item : mappings(raw, "trigger")) {
            if (isDisabled(item)) {
                continue;
            }
            triggers.add(parseTrigger(item));
        }
        return triggers;
    }

    public Trigger parseTrigger(Map<String, Object> raw) {
        String platform = getString(raw, "platform");
        if (platform == null) platform = getString(raw, "trigger");
        if (platform == null) platform = "unspecified";

        return switch (platform) {
            case "state" -> new Trigger.StateTrigger(
                    strings(raw.get("entity_id")),
                    strings(raw.get("to")),
                    getString(raw, "from"),
                    getString(raw, "attribute"),
                    getString(raw, "for"));
            case "numeric_state" -> new Trigger.NumericStateTrigger(
                    strings(raw.get("entity_id")),
                    getString(raw, "above"),
                    getString(raw, "below"),
                    getString(raw, "attribute"));
            case "zone" -> new Trigger.ZoneTrigger(
                    strings(raw.get("entity_id")), getString(raw, "zone"), getString(raw, "event"));
            case "time" -> new Trigger.TimeTrigger(times(raw.get("at")));
            case "time_pattern" -> new Trigger.TimePatternTrigger(
                    getString(raw, "hours"), getString(raw, "minutes"), getString(raw, "seconds"));
            case "sun" -> new Trigger.SunTrigger(getString(raw, "event"), getString(raw, "offset"));
            case "calendar" -> new Trigger.CalendarTrigger(
                    getString(raw, "entity_id"), getString(raw, "event"), getString(raw, "offset"));
            case "event" -> new Trigger.EventTrigger(strings(raw.get("event_type")), getMap(raw, "event_data"));
            case "mqtt" -> new Trigger.MqttTrigger(getString(raw, "topic"), getString(raw, "payload"));
            case "webhook" -> new Trigger.WebhookTrigger(getString(raw, "webhook_id"));
            case "template" -> new Trigger.TemplateTrigger(getString(raw, "value_template"));
            case "homeassistant" -> new Trigger.HomeAssistantTrigger(getString(raw, "event"));
            case "device" -> new Trigger.DeviceTrigger(
                    getString(raw, "device_id"),
                    getString(raw, "domain"),
                    getString(raw, "type"),
                    getString(raw, "entity_id"),
                    getString(raw, "subtype"));
            case "tag" -> new Trigger.TagTrigger(strings(raw.get("tag_id")));
            default -> new Trigger.UnknownTrigger(platform, parameters(raw, TRIGGER_META_KEYS));
        };
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    public List<Condition> parseConditions(Object raw) {
        List<Condition> conditions = new ArrayList<>();
        if (raw == null) {
            return conditions;
        }
        for (Object item : raw instanceof List<?> list ? list : List.of(raw)) {
            if (item instanceof Map<?, ?> && isDisabled(asMap(item))) {
                continue;
            }
            Condition condition = parseCondition(item);
            if (condition != null) {
                conditions.add(condition);
            }
        }
        return conditions;
    }

    /**
     * A template string, a mapping with a {@code condition} key, or the
     * {@code and:}/{@code or:}/{@code not:} shorthand. Returns null for
     * anything else that is not a mapping.
     */
    public Condition parseCondition(Object raw) {
        if (raw instanceof String template) {
            return new Condition.TemplateCondition(template);
        }
        if (!(raw instanceof Map<?, ?>)) {
            log.warn("Ignoring condition that is not a mapping: {}", typeName(raw));
            return null;
        }
        Map<String, Object> map = asMap(raw);

        String type = getString(map, "condition");
        if (type == null) {
            for (String shorthand : List.of("and", "or", "not")) {
                if (map.containsKey(shorthand)) {
                    return group(shorthand, parseConditions(map.get(shorthand)));
                }
            }
            return new Condition.UnknownCondition("unspecified", parameters(map, Set.of()));
        }

        return switch (type) {
            case "and", "or", "not" -> group(type, parseConditions(map.get("conditions")));
            case "state" -> new Condition.StateCondition(
                    strings(map.get("entity_id")), strings(map.get("state")), getString(map, "attribute"));
            case "numeric_state" -> new Condition.NumericStateCondition(
                    strings(map.get("entity_id")), getString(map, "above"), getString(map, "below"));
            case "zone" -> new Condition.ZoneCondition(strings(map.get("entity_id")), getString(map, "zone"));
            case "template" -> new Condition.TemplateCondition(getString(map, "value_template"));
            case "time" -> new Condition.TimeCondition(
                    time(map.get("after")), time(map.get("before")), strings(map.get("weekday")));
            case "sun" -> new Condition.SunCondition(getString(map, "after"), getString(map, "before"));
            case "trigger" -> new Condition.TriggerCondition(strings(map.get("id")));
            default -> new Condition.UnknownCondition(type, parameters(map, Set.of("condition", "enabled")));
        };
    }

    private static Condition group(String type, List<Condition> members) {
        return switch (type) {
            case "and" -> new Condition.And(members);
            case "or" -> new Condition.Or(members);
            default -> new Condition.Not(members);
        };
    }

    // ========================================================================
    // Actions
    // ========================================================================

    public List<Action> parseSequence(Object raw) {
        List<Action> steps = new ArrayList<>();
        for (Map<String, Object> step : mappings(raw, "action step")) {
            if (isDisabled(step)) {
                continue;
            }
            steps.add(parseAction(step));
        }
        return steps;
    }

    public Action parseAction(Map<String, Object> raw) {
        Object service = raw.containsKey("service") ? raw.get("service") : raw.get("action");
        if (service instanceof String name) {
            return parseServiceCall(name, raw);
        }
        if (raw.containsKey("condition")) {
            return new Action.ConditionStep(parseCondition(raw));
        }
        if (raw.containsKey("device_id") && raw.containsKey("domain")) {
            return new Action.DeviceAction(
                getString(raw, "device_id"),
                getString(raw, "domain"),
                getString(raw, "type"),
                getString(raw, "entity_id"));
        }
        if (raw.containsKey("event")) {
            return new Action.FireEvent(getString(raw, "event"), getMap(raw, "event_data"));
        }
        if (raw.containsKey("scene")) {
            return new Action.SceneActivation(getString(raw, "scene"));
        }
        if (raw.containsKey("delay")) {
            return new Action.Delay(getString(raw, "delay"));
        }
        if (raw.containsKey("wait_template")) {
            return new Action.WaitTemplate(getString(raw, "wait_template"), getString(raw, "timeout"));
        }
        if (raw.containsKey("wait_for_trigger")) {
            return new Action.WaitForTrigger(parseTriggers(raw.get("wait_for_trigger")), getString(raw, "timeout"));
        }
        if (raw.containsKey("variables")) {
            return new Action.Variables(getMap(raw, "variables"));
        }
        if (raw.containsKey("choose")) {
            return parseChoose(raw);
        }
        if (raw.containsKey("if")) {
            return new Action.If(
                parseConditions(raw.get("if")),
                parseSequence(raw.get("then")),
                raw.containsKey("else") ? parseSequence(raw.get("else")) : null);
        }
        if (raw.containsKey("parallel")) {
            return parseParallel(raw.get("parallel"));
        }
        if (raw.containsKey("sequence")) {
            return new Action.Sequence(parseSequence(raw.get("sequence")));
        }
        if (raw.containsKey("repeat")) {
            return parseRepeat(raw.get("repeat"));
        }
        if (raw.containsKey("stop")) {
            return new Action.Stop(getString(raw, "stop"), Boolean.TRUE.equals(raw.get("error")));
        }

        String type = raw.isEmpty() ? "empty" : raw.keySet().iterator().next();
        return new Action.UnknownAction(type, parameters(raw, Set.of("enabled", "alias")));
    }

    private Action.ServiceCall parseServiceCall(String service, Map<String, Object> raw) {
        Map<String, Object> data = new LinkedHashMap<>(getMap(raw, "data_template"));
        data.putAll(getMap(raw, "data"));

        List<String> entities = List.of();
        Map<String, Object> target = getMap(raw, "target");
        if (target.containsKey("entity_id")) {
            entities = strings(target.get("entity_id"));
        } else if (raw.containsKey("entity_id")) {
            entities = strings(raw.get("entity_id"));
        } else if (data.containsKey("entity_id")) {
            entities = strings(data.get("entity_id"));
        }
        return new Action.ServiceCall(service, entities, data);
    }

    private Action.Choose parseChoose(Map<String, Object> raw) {
        List<Action.ChooseOption> options = new ArrayList<>();
        for (Map<String, Object> option : mappings(raw.get("choose"), "choose option")) {
            options.add(new Action.ChooseOption(
                parseConditions(first(option, "conditions", "condition")),
                parseSequence(option.get("sequence"))));
        }
        List<Action> defaultSequence = raw.containsKey("default") ? parseSequence(raw.get("default")) : null;
        return new Action.Choose(options, defaultSequence);
    }

    /**
     * Each branch is a list of steps, a {@code sequence:} mapping, or a single step.
     */
    private Action.Parallel parseParallel(Object raw) {
        List<List<Action>> branches = new ArrayList<>();
        for (Object branch : raw instanceof List<?> list ? list : Collections.singletonList(raw)) {
            if (branch instanceof List<?>) {
                branches.add(parseSequence(branch));
            } else if (branch instanceof Map<?, ?>) {
                Map<String, Object> map = asMap(branch);
                if (isDisabled(map)) {
                    continue;
                }
                branches.add(map.size() == 1 && map.containsKey("sequence")
                    ? parseSequence(map.get("sequence"))
                    : List.of(parseAction(map)));
            } else {
                log.warn("Skipping parallel branch: not a mapping or list ({})", typeName(branch));
            }
        }
        return new Action.Parallel(branches);
    }

    private Action.Repeat parseRepeat(Object raw) {
        Map<String, Object> repeat = raw instanceof Map<?, ?> ? asMap(raw) : Map.of();
        Action.RepeatMode mode;
        if (repeat.containsKey("while")) {
            mode = Action.RepeatMode.WHILE;
        } else if (repeat.containsKey("until")) {
            mode = Action.RepeatMode.UNTIL;
        } else if (repeat.containsKey("for_each")) {
            mode = Action.RepeatMode.FOR_EACH;
        } else {
            mode = Action.RepeatMode.COUNT;
        }
        return new Action.Repeat(mode, parseSequence(repeat.get("sequence")));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Scalar as Home Assistant sees it; YAML booleans are {@code on}/{@code off}.
     */
    static String text(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag ? "on" : "off";
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return NodeCanonicalizer.canonicalText(value);
        }
        return value.toString();
    }

    /**
     * Time of day as {@code HH:MM:SS}. Other text, such as an
     * {@code input_datetime} entity, is kept unchanged. An integer is a
     * seconds count, as a plain YAML 1.1 loader produces for {@code 7:30:00}.
     */
    static String time(Object value) {
        if (value instanceof Integer seconds) {
            return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
        }
        String text = text(value);
        if (text == null) {
            return null;
        }
        Matcher clock = CLOCK_TIME.matcher(text.trim());
        if (!clock.matches()) {
            return text;
        }
        return String.format("%02d:%s:%s", Integer.parseInt(clock.group(1)), clock.group(2),
            clock.group(3) != null ? clock.group(3) : "00");
    }

    private static List<String> times(Object value) {
        List<String> result = new ArrayList<>();
        for (Object item : value instanceof List<?> list ? list : Collections.singletonList(value)) {
            if (item != null) {
                result.add(time(item));
            }
        }
        return result;
    }

    /**
     * A scalar or list of scalars as a list of text; null entries dropped.
     */
    static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (Object item : value instanceof List<?> list ? list : List.of(value)) {
            if (item != null) {
                result.add(text(item));
            }
        }
        return result;
    }

    private List<Map<String, Object>> mappings(Object raw, String what) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        for (Object item : raw instanceof List<?> list ? list : List.of(raw)) {
            if (item instanceof Map<?, ?>) {
                result.add(asMap(item));
            } else {
                log.warn("Skipping {}: not a mapping ({})", what, typeName(item));
            }
        }
        return result;
    }

    private static Map<String, String> parameters(Map<String, Object> raw, Set<String> excluded) {
        Map<String, String> parameters = new TreeMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!excluded.contains(entry.getKey()) && entry.getValue() != null) {
                parameters.put(entry.getKey(), text(entry.getValue()));
            }
        }
        return parameters;
    }

    /**
     * Copy of a decoded mapping with every key as text.
     */
    static Map<String, Object> asMap(Object raw) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            map.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return map;
    }

    private static boolean isDisabled(Map<String, Object> item) {
        return Boolean.FALSE.equals(item.get("enabled"));
    }

    private static Object first(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            if (map.get(key) != null) {
                return map.get(key);
            }
        }
        return null;
    }

    private static String getString(Map<String, Object> map, String key) {
        return text(map.get(key));
    }

    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map<?, ?> ? asMap(value) : new LinkedHashMap<>();
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
