package com.layergen.service;

import com.layergen.model.LayerKind;
import com.layergen.model.WriteMode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Which layers are regenerated on every run and which are created once and then left to the
 * developer.
 */
public final class WriteModePolicy {

    private static final Map<LayerKind, WriteMode> DEFAULTS;

    static {
        Map<LayerKind, WriteMode> defaults = new EnumMap<>(LayerKind.class);
        for (LayerKind layer : LayerKind.values()) {
            defaults.put(layer, WriteMode.OVERWRITE);
        }
        defaults.put(LayerKind.ENTITY_IMPL, WriteMode.PRESERVE);
        defaults.put(LayerKind.SERVICE_IMPL, WriteMode.PRESERVE);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<LayerKind, WriteMode> modes;

    private WriteModePolicy(Map<LayerKind, WriteMode> modes) {
        this.modes = modes;
    }

    public static WriteModePolicy defaults() {
        return new WriteModePolicy(DEFAULTS);
    }

    /**
     * Defaults with per-project overrides applied on top.
     */
    public static WriteModePolicy withOverrides(Map<LayerKind, WriteMode> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return defaults();
        }
        Map<LayerKind, WriteMode> merged = new EnumMap<>(DEFAULTS);
        merged.putAll(overrides);
        return new WriteModePolicy(Collections.unmodifiableMap(merged));
    }

    public WriteMode modeFor(LayerKind layer) {
        return modes.get(layer);
    }
}
