package com.layergen.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.layergen.service.GenerationRunTracker;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunStatusResponse {
    private boolean inProgress;
    private String currentRunId;
    private Boolean lastRunSuccess;
    private Instant lastRunTime;
    private String lastRunId;
    private String lastError;

    public static RunStatusResponse from(GenerationRunTracker.RunStatus status) {
        return RunStatusResponse.builder()
                .inProgress(status.isInProgress())
                .currentRunId(status.getCurrentRunId())
                .lastRunSuccess(status.getLastRunSuccess())
                .lastRunTime(status.getLastRunAt())
                .lastRunId(status.getLastRunId())
                .lastError(status.getLastError())
                .build();
    }
}
