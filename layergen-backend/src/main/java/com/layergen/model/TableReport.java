package com.layergen.model;

import lombok.Value;

import java.util.List;

/**
 * Outcomes of every layer of one table, in {@link LayerKind} order.
 */
@Value
public class TableReport {
    String tableName;
    List<LayerOutcome> layers;

    public TableReport(String tableName, List<LayerOutcome> layers) {
        this.tableName = tableName;
        this.layers = List.copyOf(layers);
    }

    public boolean hasFailures() {
        return layers.stream().anyMatch(o -> o.getStatus() == OutcomeStatus.FAILED);
    }

    public boolean isComplete() {
        return layers.stream().allMatch(o -> o.getStatus() == OutcomeStatus.GENERATED
                || o.getStatus() == OutcomeStatus.SKIPPED_PRESERVED);
    }
}
