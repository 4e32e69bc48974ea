package com.layergen.service;

import com.layergen.model.LayerKind;
import com.layergen.model.WriteMode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WriteModePolicyTest {

    @Test
    void implementationsArePreservedEverythingElseOverwritten() {
        WriteModePolicy policy = WriteModePolicy.defaults();

        assertThat(policy.modeFor(LayerKind.ENTITY_IMPL)).isEqualTo(WriteMode.PRESERVE);
        assertThat(policy.modeFor(LayerKind.SERVICE_IMPL)).isEqualTo(WriteMode.PRESERVE);
        assertThat(policy.modeFor(LayerKind.ENTITY_BASE)).isEqualTo(WriteMode.OVERWRITE);
        assertThat(policy.modeFor(LayerKind.DATA_ACCESS_INTERFACE)).isEqualTo(WriteMode.OVERWRITE);
        assertThat(policy.modeFor(LayerKind.SERVICE_INTERFACE)).isEqualTo(WriteMode.OVERWRITE);
        assertThat(policy.modeFor(LayerKind.REQUEST_HANDLER)).isEqualTo(WriteMode.OVERWRITE);
        assertThat(policy.modeFor(LayerKind.MAPPING_CONFIG)).isEqualTo(WriteMode.OVERWRITE);
    }

    @Test
    void overridesApplyOnTopOfDefaults() {
        WriteModePolicy policy = WriteModePolicy.withOverrides(Map.of(LayerKind.REQUEST_HANDLER, WriteMode.PRESERVE));

        assertThat(policy.modeFor(LayerKind.REQUEST_HANDLER)).isEqualTo(WriteMode.PRESERVE);
        assertThat(policy.modeFor(LayerKind.SERVICE_IMPL)).isEqualTo(WriteMode.PRESERVE);
        assertThat(policy.modeFor(LayerKind.ENTITY_BASE)).isEqualTo(WriteMode.OVERWRITE);
    }
}
