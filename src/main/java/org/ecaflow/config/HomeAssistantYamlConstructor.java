package org.ecaflow.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Safe constructor that also accepts Home Assistant's local tags
 * ({@code !secret}, {@code !include}, {@code !input}, {@code !env_var}, ...).
 *
 * A tagged scalar loads as {@code "<tag> <value>"}, e.g. {@code "!secret api_key"},
 * so it still identifies what it refers to. Tagged collections load as plain
 * lists and maps.
 */
public class HomeAssistantYamlConstructor extends SafeConstructor {

    static final String LOCAL_TAG_PREFIX = "!";

    public HomeAssistantYamlConstructor(LoaderOptions options) {
        super(options);
        this.yamlMultiConstructors.put(LOCAL_TAG_PREFIX, new ConstructLocalTag());
    }

    private class ConstructLocalTag extends AbstractConstruct {
        @Override
        public Object construct(Node node) {
            if (node instanceof ScalarNode scalar) {
                String value = constructScalar(scalar);
                String tag = node.getTag().getValue();
                return value.isEmpty() ? tag : tag + " " + value;
            }
            if (node instanceof SequenceNode sequence) {
                return constructSequence(sequence);
            }
            return constructMapping((MappingNode) node);
        }
    }
}
