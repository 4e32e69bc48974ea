package com.layergen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-table, per-layer outcome of a generation run. Built once when the run finishes.
 */
@Value
@Builder
public class GenerationReport {
    String runId;
    Instant startedAt;
    Instant finishedAt;

    /**
     * True when the selection policy matched no table; the run then has zero tasks.
     */
    boolean selectionEmpty;

    boolean cancelled;

    @Singular
    List<TableReport> tables;

    public int getTotalTables() {
        return tables.size();
    }

    public long count(OutcomeStatus status) {
        return tables.stream()
                .flatMap(t -> t.getLayers().stream())
                .filter(o -> o.getStatus() == status)
                .count();
    }

    public long getFailedCount() {
        return count(OutcomeStatus.FAILED);
    }

    /**
     * A run succeeds when no task failed and none was cancelled. Files written by a partially
     * successful run stay on disk either way.
     */
    public boolean isSuccess() {
        return getFailedCount() == 0 && count(OutcomeStatus.CANCELLED) == 0;
    }

    public List<String> getCompletedTables() {
        return tables.stream()
                .filter(TableReport::isComplete)
                .map(TableReport::getTableName)
                .collect(Collectors.toList());
    }

    public List<String> getFailedTables() {
        return tables.stream()
                .filter(TableReport::hasFailures)
                .map(TableReport::getTableName)
                .collect(Collectors.toList());
    }

    public Optional<TableReport> findTable(String tableName) {
        return tables.stream().filter(t -> t.getTableName().equals(tableName)).findFirst();
    }

    public Map<String, TableReport> byTable() {
        return tables.stream().collect(Collectors.toMap(TableReport::getTableName, Function.identity()));
    }

    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Multi-line listing of every table and layer, as printed at the end of a run.
     */
    public String toSummaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Generation run ").append(runId)
                .append(": tables=").append(getTotalTables())
                .append(", generated=").append(count(OutcomeStatus.GENERATED))
                .append(", skipped_preserved=").append(count(OutcomeStatus.SKIPPED_PRESERVED))
                .append(", failed=").append(getFailedCount())
                .append(", cancelled=").append(count(OutcomeStatus.CANCELLED))
                .append("\n");
        if (selectionEmpty) {
            sb.append("  no table matched the selection policy\n");
        }
        for (TableReport table : tables) {
            sb.append("  ").append(table.getTableName()).append("\n");
            for (LayerOutcome outcome : table.getLayers()) {
                sb.append("    ").append(outcome.getLayer()).append(": ").append(outcome.describe()).append("\n");
            }
        }
        return sb.toString();
    }
}
