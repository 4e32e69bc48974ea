package com.layergen.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthResponse {
    /**
     * {@code healthy} or {@code unhealthy}.
     */
    private String status;
    private boolean databaseConnected;
    private boolean oracleEnabled;
    private boolean generationInProgress;
}
