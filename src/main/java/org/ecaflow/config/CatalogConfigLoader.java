package org.ecaflow.config;

import org.ecaflow.model.ServiceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Loads the service catalog (effects, conflict pairs, signature qualifiers)
 * from YAML.
 *
 * <pre>
 * effects:
 *   light.turn_on: "on"
 * conflicts:
 *   - [light.turn_on, light.turn_off]
 * qualifiers:
 *   climate.set_hvac_mode: hvac_mode
 * </pre>
 *
 * All sections are optional. The bundled default lives at {@link #DEFAULT_RESOURCE}.
 */
public class CatalogConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/catalog/default-catalog.yaml";

    private final Yaml yaml;

    public CatalogConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // Loading Methods
    // ========================================================================

    /**
     * The catalog shipped on the classpath.
     */
    public ServiceCatalog loadDefault() {
        try (InputStream is = CatalogConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Default catalog not found on classpath: " + DEFAULT_RESOURCE);
            }
            ServiceCatalog catalog = parse(yaml.load(new InputStreamReader(is, StandardCharsets.UTF_8)));
            log.debug("Loaded default catalog: {}", catalog);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public ServiceCatalog loadFromFile(Path yamlFile) throws IOException {
        try (InputStream is = Files.newInputStream(yamlFile)) {
            ServiceCatalog catalog = parse(yaml.load(new InputStreamReader(is, StandardCharsets.UTF_8)));
            log.info("Loaded catalog from {}: {}", yamlFile, catalog);
            return catalog;
        }
    }

    public ServiceCatalog loadFromString(String yamlContent) {
        return parse(yaml.load(yamlContent));
    }

    /**
     * The default catalog with a user file merged on top, or the user file
     * alone when {@code replaceDefault} is set.
     */
    public ServiceCatalog loadWithOverrides(Path userCatalog, boolean replaceDefault) throws IOException {
        ServiceCatalog user = loadFromFile(userCatalog);
        return replaceDefault ? user : loadDefault().merge(user);
    }

    // ========================================================================
    // Parsing
    // ========================================================================

    private ServiceCatalog parse(Object raw) {
        if (raw == null) {
            return ServiceCatalog.EMPTY;
        }
        if (!(raw instanceof Map<?, ?> root)) {
            throw new CatalogFormatException("Catalog must be a mapping, got " + raw.getClass().getSimpleName());
        }

        ServiceCatalog.Builder builder = new ServiceCatalog.Builder();
        try {
            for (Map.Entry<?, ?> entry : section(root, "effects").entrySet()) {
                builder.effect(String.valueOf(entry.getKey()), scalar(entry.getValue(), "effect of " + entry.getKey()));
            }
            for (Map.Entry<?, ?> entry : section(root, "qualifiers").entrySet()) {
                builder.qualifier(String.valueOf(entry.getKey()), scalar(entry.getValue(), "qualifier of " + entry.getKey()));
            }
            Object conflicts = root.get("conflicts");
            if (conflicts != null) {
                if (!(conflicts instanceof List<?> pairs)) {
                    throw new CatalogFormatException("'conflicts' must be a list of signature pairs");
                }
                for (Object pair : pairs) {
                    if (!(pair instanceof List<?> members) || members.size() != 2) {
                        throw new CatalogFormatException("Conflict entry must list exactly two signatures: " + pair);
                    }
                    builder.conflict(scalar(members.get(0), "conflict"), scalar(members.get(1), "conflict"));
                }
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CatalogFormatException("Invalid catalog entry: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static Map<?, ?> section(Map<?, ?> root, String name) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new CatalogFormatException("'" + name + "' must be a mapping");
        }
        return map;
    }

    private static String scalar(Object value, String what) {
        if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            throw new CatalogFormatException("Expected a scalar for " + what + ", got " + value);
        }
        return RuleDefinitionParser.text(value);
    }

    // ========================================================================
    // Exceptions
    // ========================================================================

    /**
     * Catalog content that does not have the expected structure.
     */
    public static class CatalogFormatException extends RuntimeException {
        public CatalogFormatException(String message) {
            super(message);
        }

        public CatalogFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
