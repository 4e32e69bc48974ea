package com.layergen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable settings for one generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationConfig {
    /**
     * Module name; becomes a package segment and the mapper XML directory.
     */
    String moduleName;

    @Builder.Default
    String basePackage = "com.example";

    /**
     * Root of the project that receives generated files.
     */
    Path projectRoot;

    String promptTemplate;

    TableSelectionPolicy selectionPolicy;

    @Builder.Default
    int parallelism = 4;

    @Builder.Default
    String author = "layergen";

    @Singular
    Map<LayerKind, WriteMode> writeModeOverrides;

    public GenerationConfig withSelectionPolicy(TableSelectionPolicy policy) {
        return toBuilder().selectionPolicy(policy).build();
    }
}
