package com.layergen.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * One (table, layer) unit of work with its resolved destination.
 */
@Value
public class GenerationTask {
    TableSchema table;
    LayerKind layer;
    Path targetPath;
    WriteMode writeMode;

    public String describe() {
        return "table=" + table.getName() + ", layer=" + layer;
    }
}
