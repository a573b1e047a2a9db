package org.ecaflow.config;

import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.util.regex.Pattern;

/**
 * YAML 1.1 resolver without base 60 integers.
 *
 * Home Assistant reads {@code at: 7:30} as a time of day, while plain YAML 1.1
 * resolves it to the integer 450. Colon-separated scalars stay text here, and
 * {@link RuleDefinitionParser} turns them into {@code HH:MM:SS}.
 */
public class HomeAssistantYamlResolver extends Resolver {

    static final Pattern DECIMAL_INT = Pattern.compile(
        "^(?:[-+]?0b_*[0-1]+[0-1_]*"
            + "|[-+]?0_*[0-7]+[0-7_]*"
            + "|[-+]?(?:0|[1-9][0-9_]*)"
            + "|[-+]?0x_*[0-9a-fA-F]+[0-9a-fA-F_]*)$");

    @Override
    public void addImplicitResolver(Tag tag, Pattern regexp, String first) {
        super.addImplicitResolver(tag, Tag.INT.equals(tag) ? DECIMAL_INT : regexp, first);
    }

    @Override
    public void addImplicitResolver(Tag tag, Pattern regexp, String first, int limit) {
        super.addImplicitResolver(tag, Tag.INT.equals(tag) ? DECIMAL_INT : regexp, first, limit);
    }
}
