package com.layergen.model;

public enum TaskStage {
    PROMPTING,
    SYNTHESIZING,
    WRITING,
    DONE
}
