package com.layergen.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.layergen.schema.DatabaseInfo;
import lombok.Builder;
import lombok.Data;

/**
 * Response for {@code GET /api/codegen/database}. The password is never included.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DatabaseInfoResponse {
    private String url;
    private String dbType;
    private String user;
    private boolean connected;
    private String productName;
    private String version;
    private String error;

    public static DatabaseInfoResponse from(DatabaseInfo info) {
        return DatabaseInfoResponse.builder()
                .url(info.getUrl())
                .dbType(info.getDbType())
                .user(info.getUsername())
                .connected(info.isConnected())
                .productName(info.getProductName())
                .version(info.getProductVersion())
                .error(info.getError())
                .build();
    }
}
