package com.layergen.schema;

import lombok.Builder;
import lombok.Value;

/**
 * Connection details of the schema source. Never carries the password.
 */
@Value
@Builder
public class DatabaseInfo {
    String url;
    String dbType;
    String username;
    boolean connected;
    String productName;
    String productVersion;
    String error;
}
