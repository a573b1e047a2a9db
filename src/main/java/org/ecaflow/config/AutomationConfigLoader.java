package org.ecaflow.config;

import org.ecaflow.model.Automation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.representer.Representer;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Loads Home Assistant automation definitions from YAML.
 *
 * Accepted document shapes:
 * - a list of automations ({@code automations.yaml})
 * - a mapping with an {@code automation} key ({@code configuration.yaml} or a package)
 * - a single automation mapping
 *
 * Multi-document streams are concatenated in document order.
 */
public class AutomationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(AutomationConfigLoader.class);

    static final String AUTOMATION_KEY = "automation";

    private final Yaml yaml;
    private final RuleDefinitionParser parser;

    public AutomationConfigLoader() {
        this(new RuleDefinitionParser());
    }

    public AutomationConfigLoader(RuleDefinitionParser parser) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        DumperOptions dumperOptions = new DumperOptions();
        this.yaml = new Yaml(new HomeAssistantYamlConstructor(options), new Representer(dumperOptions),
            dumperOptions, options, new HomeAssistantYamlResolver());
        this.parser = parser;
    }

    // ========================================================================
    // Loading Methods
    // ========================================================================

    /**
     * Load automations from a YAML file.
     */
    public List<Automation> loadFromFile(Path yamlFile) throws IOException {
        log.info("Loading automations from {}", yamlFile);
        try (InputStream is = Files.newInputStream(yamlFile)) {
            return loadFromStream(is);
        }
    }

    /**
     * Load automations from a YAML string.
     */
    public List<Automation> loadFromString(String yamlContent) {
        return parser.parseAutomations(decode(yaml.loadAll(yamlContent)));
    }

    public List<Automation> loadFromStream(InputStream in) {
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        return parser.parseAutomations(decode(yaml.loadAll(reader)));
    }

    /**
     * Flatten the decoded documents into one list of raw automation entries.
     *
     * @throws IllegalArgumentException if a document is neither a mapping nor a list
     */
    List<Object> decode(Iterable<Object> documents) {
        List<Object> entries = new ArrayList<>();
        int index = 0;
        for (Object document : documents) {
            index++;
            if (document == null) {
                continue;
            }
            if (document instanceof List<?> list) {
                entries.addAll(list);
            } else if (document instanceof Map<?, ?> map) {
                if (map.containsKey(AUTOMATION_KEY)) {
                    Object automations = map.get(AUTOMATION_KEY);
                    if (automations instanceof List<?> list) {
                        entries.addAll(list);
                    } else if (automations != null) {
                        entries.add(automations);
                    }
                } else {
                    entries.add(map);
                }
            } else {
                throw new IllegalArgumentException(String.format(
                    "Document %d is not a mapping or list of automations: %s",
                    index, document.getClass().getSimpleName()));
            }
        }
        log.debug("Decoded {} automation entries from {} document(s)", entries.size(), index);
        return entries;
    }
}
