package org.ecaflow.config;

import org.ecaflow.model.Action;
import org.ecaflow.model.Automation;
import org.ecaflow.model.Trigger;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomationConfigLoaderTest {

    private final AutomationConfigLoader loader = new AutomationConfigLoader();

    @Test
    void shouldConcatenatePackageAndListDocuments() throws Exception {
        // Given
        List<Automation> automations;
        try (InputStream in = getClass().getResourceAsStream("/automations/package.yaml")) {
            // When
            automations = loader.loadFromStream(in);
        }

        // Then
        assertThat(automations).extracting(Automation::id).containsExactly("night_mode", "rule_2");
        assertThat(automations.get(0).triggers())
            .containsExactly(new Trigger.TimeTrigger(List.of("22:00:00")));
        assertThat(automations.get(1).triggers())
            .containsExactly(new Trigger.SunTrigger("sunset", "-00:30:00"));
    }

    @Test
    void shouldLoadLocalTagsAsText() throws Exception {
        // Given
        List<Automation> automations;
        try (InputStream in = getClass().getResourceAsStream("/automations/package.yaml")) {
            automations = loader.loadFromStream(in);
        }

        // When
        Action.ServiceCall notify = (Action.ServiceCall) automations.get(0).actions().get(1);

        // Then
        assertThat(notify.data()).containsEntry("message", "!secret night_message");
    }

    @Test
    void shouldAcceptSingleAutomationMapping() {
        // Given
        String yaml = """
            alias: Single
            trigger:
              platform: state
              entity_id: switch.a
              to: "off"
            action:
              service: switch.turn_on
              entity_id: switch.a
            """;

        // When
        List<Automation> automations = loader.loadFromString(yaml);

        // Then
        assertThat(automations).singleElement().satisfies(automation -> {
            assertThat(automation.id()).isEqualTo("Single");
            assertThat(automation.triggers()).hasSize(1);
            assertThat(automation.actions()).hasSize(1);
        });
    }

    @Test
    void shouldRejectScalarDocument() {
        assertThatThrownBy(() -> loader.loadFromString("just text"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a mapping or list");
    }

    @Test
    void shouldRejectDuplicateKeys() {
        String yaml = """
            - alias: A
              alias: B
            """;

        assertThatThrownBy(() -> loader.loadFromString(yaml)).isInstanceOf(YAMLException.class);
    }

    @Test
    void shouldIgnoreEmptyDocuments() {
        assertThat(loader.loadFromString("")).isEmpty();
        assertThat(loader.loadFromString("---\n---\n")).isEmpty();
    }
}
