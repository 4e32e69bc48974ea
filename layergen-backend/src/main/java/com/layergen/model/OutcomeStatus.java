package com.layergen.model;

public enum OutcomeStatus {
    GENERATED("generated"),
    SKIPPED_PRESERVED("skipped-preserved"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String label;

    OutcomeStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
