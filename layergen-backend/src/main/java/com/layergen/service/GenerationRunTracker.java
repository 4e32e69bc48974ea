package com.layergen.service;

import com.layergen.model.GenerationReport;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the current and last run state for the status and health endpoints.
 */
@Component
public class GenerationRunTracker {

    @Value
    @Builder(toBuilder = true)
    public static class RunStatus {
        boolean inProgress;
        String currentRunId;
        Instant currentRunStartedAt;

        /**
         * {@code null} until a run has finished.
         */
        Boolean lastRunSuccess;
        Instant lastRunAt;
        String lastRunId;
        String lastError;
        GenerationReport lastReport;
    }

    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.builder().build());

    public void markStarted(String runId, Instant startedAt) {
        status.updateAndGet(s -> s.toBuilder()
                .inProgress(true)
                .currentRunId(runId)
                .currentRunStartedAt(startedAt)
                .build());
    }

    public void markFinished(GenerationReport report) {
        status.updateAndGet(s -> s.toBuilder()
                .inProgress(false)
                .currentRunId(null)
                .currentRunStartedAt(null)
                .lastRunSuccess(report.isSuccess())
                .lastRunAt(report.getFinishedAt())
                .lastRunId(report.getRunId())
                .lastError(null)
                .lastReport(report)
                .build());
    }

    /**
     * Record a run that ended before producing a report (connection or configuration error).
     */
    public void markAborted(String runId, String error) {
        status.updateAndGet(s -> s.toBuilder()
                .inProgress(false)
                .currentRunId(null)
                .currentRunStartedAt(null)
                .lastRunSuccess(false)
                .lastRunAt(Instant.now())
                .lastRunId(runId)
                .lastError(error)
                .lastReport(null)
                .build());
    }

    public RunStatus snapshot() {
        return status.get();
    }
}
