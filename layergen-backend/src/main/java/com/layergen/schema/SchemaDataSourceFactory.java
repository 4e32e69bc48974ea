package com.layergen.schema;

import com.layergen.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds the short-lived connection pool used for one introspection pass.
 */
@Component
public class SchemaDataSourceFactory {
    private final AtomicLong poolCounter = new AtomicLong();

    /**
     * Create a pool. The pool connects eagerly, so an unreachable database fails here.
     *
     * @param info connection descriptor
     * @param purpose short label used in the pool name
     * @return open data source, to be closed by the caller
     */
    public HikariDataSource create(JdbcConnectionInfo info, String purpose) {
        return new HikariDataSource(buildHikariConfig(info, purpose));
    }

    HikariConfig buildHikariConfig(JdbcConnectionInfo info, String purpose) {
        if (info == null || info.getUrl() == null || info.getUrl().isBlank()) {
            throw new IllegalArgumentException("JDBC URL is required");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(info.getUrl());
        config.setUsername(info.getUsername());
        config.setPassword(info.getPassword());

        if ("postgres".equalsIgnoreCase(info.getDbType())) {
            config.setDriverClassName("org.postgresql.Driver");
            config.addDataSourceProperty("ApplicationName", "layergen");
        }
        // Other drivers are located through DriverManager from the URL.

        config.setReadOnly(true);
        config.setAutoCommit(true);
        config.setConnectionTimeout(Math.max(250, info.getConnectionTimeoutMs()));
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(0);
        config.setPoolName("layergen-" + purpose + "-" + poolCounter.incrementAndGet());
        return config;
    }
}
