package org.ecaflow.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceCatalogTest {

    private final ServiceCatalog catalog = new ServiceCatalog.Builder()
        .effect("light.turn_on", "on")
        .effect("light.turn_off", "off")
        .effect("climate.set_hvac_mode", "hvac_mode_changed")
        .effect("climate.set_hvac_mode:cool", "cool")
        .conflict("light.turn_on", "light.turn_off")
        .qualifier("climate.set_hvac_mode", "hvac_mode")
        .build();

    @Test
    void shouldFallBackToBaseSignatureForUnlistedQualifier() {
        assertThat(catalog.effectOf("climate.set_hvac_mode:cool")).contains("cool");
        assertThat(catalog.effectOf("climate.set_hvac_mode:dry")).contains("hvac_mode_changed");
        assertThat(catalog.effectOf("switch.toggle")).isEmpty();
        assertThat(catalog.effectOf(null)).isEmpty();
    }

    @Test
    void shouldTreatConflictPairsAsUnordered() {
        assertThat(catalog.conflicts("light.turn_on", "light.turn_off")).isTrue();
        assertThat(catalog.conflicts("light.turn_off", "light.turn_on")).isTrue();
        assertThat(catalog.conflicts("light.turn_on", "light.turn_on")).isFalse();
        assertThat(catalog.conflicts("light.turn_on", null)).isFalse();
    }

    @Test
    void shouldCollapseReversedConflictRegistration() {
        // Given
        ServiceCatalog both = new ServiceCatalog.Builder()
            .conflict("lock.lock", "lock.unlock")
            .conflict("lock.unlock", "lock.lock")
            .build();

        // Then
        assertThat(both.getConflictCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectSelfConflict() {
        assertThatThrownBy(() -> new ServiceCatalog.Builder().conflict("fan.turn_on", "fan.turn_on"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOverrideEffectsAndAccumulateConflictsOnMerge() {
        // Given
        ServiceCatalog overlay = new ServiceCatalog.Builder()
            .effect("light.turn_on", "bright")
            .conflict("cover.open_cover", "cover.close_cover")
            .build();

        // When
        ServiceCatalog merged = catalog.merge(overlay);

        // Then
        assertThat(merged.effectOf("light.turn_on")).contains("bright");
        assertThat(merged.effectOf("light.turn_off")).contains("off");
        assertThat(merged.conflicts("light.turn_on", "light.turn_off")).isTrue();
        assertThat(merged.conflicts("cover.close_cover", "cover.open_cover")).isTrue();
        assertThat(merged.qualifierFieldFor("climate.set_hvac_mode")).contains("hvac_mode");
    }

    @Test
    void shouldStripQualifierForBaseSignature() {
        assertThat(ServiceCatalog.baseSignature("climate.set_hvac_mode:heat")).isEqualTo("climate.set_hvac_mode");
        assertThat(ServiceCatalog.baseSignature("light.turn_on")).isEqualTo("light.turn_on");
    }
}
