package org.ecaflow.config;

import org.ecaflow.config.CatalogConfigLoader.CatalogFormatException;
import org.ecaflow.model.ServiceCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogConfigLoaderTest {

    private final CatalogConfigLoader loader = new CatalogConfigLoader();

    @Test
    void shouldLoadBundledDefaults() {
        // When
        ServiceCatalog catalog = loader.loadDefault();

        // Then
        assertThat(catalog.effectOf("switch.turn_on")).contains("on");
        assertThat(catalog.effectOf("lock.unlock")).contains("unlocked");
        assertThat(catalog.effectOf("climate.set_hvac_mode:heat")).contains("heat");
        assertThat(catalog.effectOf("climate.set_hvac_mode:auto")).contains("hvac_mode_changed");
        assertThat(catalog.conflicts("light.turn_off", "light.turn_on")).isTrue();
        assertThat(catalog.conflicts("climate.set_hvac_mode:cool", "climate.set_hvac_mode:heat")).isTrue();
        assertThat(catalog.qualifierFieldFor("climate.set_hvac_mode")).contains("hvac_mode");
    }

    @Test
    void shouldReadUnquotedOnOffAsStates() {
        // Given
        String yaml = """
            effects:
              siren.turn_on: on
              siren.turn_off: off
            conflicts:
              - [siren.turn_on, siren.turn_off]
            """;

        // When
        ServiceCatalog catalog = loader.loadFromString(yaml);

        // Then
        assertThat(catalog.effectOf("siren.turn_on")).contains("on");
        assertThat(catalog.effectOf("siren.turn_off")).contains("off");
        assertThat(catalog.getConflictCount()).isEqualTo(1);
    }

    @Test
    void shouldMergeUserCatalogOverDefault(@TempDir Path dir) throws Exception {
        // Given
        Path file = dir.resolve("extra.yaml");
        Files.writeString(file, "effects:\n  light.turn_on: bright\n  siren.turn_on: \"on\"\n");

        // When
        ServiceCatalog merged = loader.loadWithOverrides(file, false);
        ServiceCatalog replaced = loader.loadWithOverrides(file, true);

        // Then
        assertThat(merged.effectOf("light.turn_on")).contains("bright");
        assertThat(merged.effectOf("lock.lock")).contains("locked");
        assertThat(replaced.effectOf("lock.lock")).isEmpty();
        assertThat(replaced.getEffectCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectMalformedConflicts() {
        assertThatThrownBy(() -> loader.loadFromString("conflicts:\n  - [a.b]\n"))
            .isInstanceOf(CatalogFormatException.class);
        assertThatThrownBy(() -> loader.loadFromString("conflicts:\n  - [a.b, a.b]\n"))
            .isInstanceOf(CatalogFormatException.class);
        assertThatThrownBy(() -> loader.loadFromString("- not a mapping\n"))
            .isInstanceOf(CatalogFormatException.class);
    }

    @Test
    void shouldTreatEmptyContentAsEmptyCatalog() {
        assertThat(loader.loadFromString("").getEffectCount()).isZero();
    }
}
