package com.layergen.writer;

public enum WriteOutcome {
    WRITTEN,
    SKIPPED_PRESERVED
}
