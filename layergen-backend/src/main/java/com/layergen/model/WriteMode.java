package com.layergen.model;

public enum WriteMode {
    /**
     * System-owned file, atomically replaced on every run.
     */
    OVERWRITE,
    /**
     * Starting point for manual edits, created once and never replaced.
     */
    PRESERVE
}
