package com.layergen.util;

import lombok.Builder;
import lombok.Value;

/**
 * Connection descriptor for the schema source.
 */
@Value
@Builder(toBuilder = true)
public class JdbcConnectionInfo {
    String url;
    String username;
    String password;
    String dbType;

    /**
     * Schema to introspect; {@code null} means the connection's current schema.
     */
    String schema;

    @Builder.Default
    long connectionTimeoutMs = 5000;

    /**
     * JDBC URL with any inline password replaced by {@code ****}.
     */
    public String maskedUrl() {
        if (url == null) {
            return null;
        }
        return DsnParser.mask(url)
                .replaceAll("(?i)(password=)[^&;]*", "$1****");
    }

    @Override
    public String toString() {
        return "JdbcConnectionInfo(url=" + maskedUrl() + ", username=" + username + ", dbType=" + dbType + ", schema=" + schema + ")";
    }
}
