package com.layergen.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.layergen.model.GenerationReport;
import com.layergen.model.LayerOutcome;
import com.layergen.model.OutcomeStatus;
import com.layergen.model.TableReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response for {@code GET|POST /api/codegen/generate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CodegenResponse {
    private boolean success;
    private String message;
    private String runId;
    private int totalTables;
    private List<String> generatedTables;
    private List<String> failedTables;
    private boolean selectionEmpty;
    private boolean cancelled;
    private long durationMs;

    @Builder.Default
    private List<TableDetail> tables = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TableDetail {
        private String table;
        private List<LayerDetail> layers;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class LayerDetail {
        private String layer;
        private String status;
        private String path;
        private String stage;
        private String failureKind;
        private String reason;
        private int attempts;
    }

    public static CodegenResponse from(GenerationReport report) {
        String message;
        if (report.isSelectionEmpty()) {
            message = "No table matched the selection";
        } else if (report.isCancelled()) {
            message = "Generation cancelled";
        } else if (report.isSuccess()) {
            message = "Code generation completed";
        } else {
            message = "Code generation finished with " + report.getFailedCount() + " failed task(s)";
        }
        return CodegenResponse.builder()
                .success(report.isSuccess())
                .message(message)
                .runId(report.getRunId())
                .totalTables(report.getTotalTables())
                .generatedTables(report.getCompletedTables())
                .failedTables(report.getFailedTables())
                .selectionEmpty(report.isSelectionEmpty())
                .cancelled(report.isCancelled())
                .durationMs(report.getDuration().toMillis())
                .tables(report.getTables().stream().map(CodegenResponse::toDetail).collect(Collectors.toList()))
                .build();
    }

    private static TableDetail toDetail(TableReport table) {
        return TableDetail.builder()
                .table(table.getTableName())
                .layers(table.getLayers().stream().map(CodegenResponse::toDetail).collect(Collectors.toList()))
                .build();
    }

    private static LayerDetail toDetail(LayerOutcome outcome) {
        return LayerDetail.builder()
                .layer(outcome.getLayer().name())
                .status(outcome.getStatus().getLabel())
                .path(outcome.getTargetPath() != null ? outcome.getTargetPath().toString() : null)
                .stage(outcome.getStatus() == OutcomeStatus.FAILED && outcome.getFailedStage() != null
                        ? outcome.getFailedStage().name() : null)
                .failureKind(outcome.getFailureKind())
                .reason(outcome.getReason())
                .attempts(outcome.getAttempts())
                .build();
    }
}
