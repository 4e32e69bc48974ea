package com.layergen.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Result of one generation task.
 */
@Value
@Builder
public class LayerOutcome {
    LayerKind layer;
    OutcomeStatus status;
    Path targetPath;

    /**
     * Failure or cancellation reason; {@code null} for generated and preserved files.
     */
    String reason;

    /**
     * Stage the task was in when it failed; {@code null} unless failed.
     */
    TaskStage failedStage;

    /**
     * Short failure category such as {@code MALFORMED_RESPONSE}; {@code null} unless failed.
     */
    String failureKind;

    /**
     * Oracle calls made for this task.
     */
    int attempts;

    public static LayerOutcome generated(GenerationTask task, int attempts) {
        return LayerOutcome.builder()
                .layer(task.getLayer())
                .status(OutcomeStatus.GENERATED)
                .targetPath(task.getTargetPath())
                .attempts(attempts)
                .build();
    }

    public static LayerOutcome preserved(GenerationTask task, int attempts) {
        return LayerOutcome.builder()
                .layer(task.getLayer())
                .status(OutcomeStatus.SKIPPED_PRESERVED)
                .targetPath(task.getTargetPath())
                .attempts(attempts)
                .build();
    }

    public static LayerOutcome failed(GenerationTask task, TaskStage stage, String failureKind, String reason, int attempts) {
        return LayerOutcome.builder()
                .layer(task.getLayer())
                .status(OutcomeStatus.FAILED)
                .targetPath(task.getTargetPath())
                .failedStage(stage)
                .failureKind(failureKind)
                .reason(reason)
                .attempts(attempts)
                .build();
    }

    public static LayerOutcome cancelled(GenerationTask task) {
        return LayerOutcome.builder()
                .layer(task.getLayer())
                .status(OutcomeStatus.CANCELLED)
                .targetPath(task.getTargetPath())
                .reason("run cancelled before task started")
                .build();
    }

    /**
     * Human readable form used in the run summary, e.g. {@code failed: MALFORMED_RESPONSE ...}.
     */
    public String describe() {
        if (status == OutcomeStatus.FAILED) {
            return status.getLabel() + ": " + reason;
        }
        return status.getLabel();
    }
}
