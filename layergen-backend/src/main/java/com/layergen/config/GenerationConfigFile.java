package com.layergen.config;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw content of the generation YAML file, before validation.
 */
@Data
public class GenerationConfigFile {
    private String moduleName;
    private String basePackage;
    private String projectRoot;

    /**
     * Literal table-name prefixes; used when {@link #allowedTables} is empty.
     */
    private List<String> tablePrefixes;

    /**
     * Exact table names; takes precedence over {@link #tablePrefixes}.
     */
    private List<String> allowedTables;

    /**
     * Prompt template location, a file path or a {@code classpath:} resource.
     */
    private String promptTemplate;

    private Integer parallelism;
    private String author;

    /**
     * Layer name to {@code overwrite} or {@code preserve}.
     */
    private Map<String, String> writeModes;
}
