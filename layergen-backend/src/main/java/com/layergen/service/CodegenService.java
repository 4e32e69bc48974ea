package com.layergen.service;

import com.layergen.config.ConnectionDescriptorResolver;
import com.layergen.config.GenerationConfigLoader;
import com.layergen.model.GenerationConfig;
import com.layergen.model.GenerationReport;
import com.layergen.model.TableSelectionPolicy;
import com.layergen.oracle.CodeSynthesisClient;
import com.layergen.schema.DatabaseInfo;
import com.layergen.schema.SchemaIntrospector;
import com.layergen.util.JdbcConnectionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point used by the HTTP surface and the startup runner. Configuration and connection
 * settings are resolved again for every call.
 */
@Slf4j
@Service
public class CodegenService {

    private final GenerationOrchestrator orchestrator;
    private final GenerationConfigLoader configLoader;
    private final ConnectionDescriptorResolver connectionResolver;
    private final SchemaIntrospector introspector;
    private final GenerationRunTracker runTracker;
    private final CodeSynthesisClient synthesisClient;

    public CodegenService(
            GenerationOrchestrator orchestrator,
            GenerationConfigLoader configLoader,
            ConnectionDescriptorResolver connectionResolver,
            SchemaIntrospector introspector,
            GenerationRunTracker runTracker,
            CodeSynthesisClient synthesisClient
    ) {
        this.orchestrator = orchestrator;
        this.configLoader = configLoader;
        this.connectionResolver = connectionResolver;
        this.introspector = introspector;
        this.runTracker = runTracker;
        this.synthesisClient = synthesisClient;
    }

    /**
     * Generate every table selected by the configuration file.
     */
    public GenerationReport generateConfigured() {
        GenerationConfig config = beforeRun(configLoader::load);
        return orchestrator.run(beforeRun(connectionResolver::resolve), config);
    }

    /**
     * Generate exactly the named tables, ignoring the configured selection.
     *
     * @param tables table names, must not be empty
     * @throws IllegalArgumentException when no table name is given
     */
    public GenerationReport generateTables(List<String> tables) {
        Set<String> names = new LinkedHashSet<>();
        if (tables != null) {
            for (String table : tables) {
                if (table != null && !table.isBlank()) {
                    names.add(table.trim());
                }
            }
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Table list must not be empty");
        }
        GenerationConfig config = beforeRun(configLoader::load).withSelectionPolicy(TableSelectionPolicy.allowList(names));
        log.info("Generating selected tables: tables={}", names);
        return orchestrator.run(beforeRun(connectionResolver::resolve), config);
    }

    /**
     * Run a preparation step of a generation request. A failure here ends the request before
     * the orchestrator starts, so it is recorded as the last run outcome unless another run is
     * active.
     */
    private <T> T beforeRun(Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            if (!orchestrator.isRunning()) {
                runTracker.markAborted(null, e.getMessage());
            }
            log.error("Generation request failed before start: error={}", e.getMessage());
            throw e;
        }
    }

    public List<String> listTables(String prefix) {
        return introspector.listTableNames(connectionResolver.resolve(), prefix);
    }

    public DatabaseInfo describeDatabase() {
        return introspector.describeDatabase(connectionResolver.resolve());
    }

    public boolean checkDatabase() {
        JdbcConnectionInfo info;
        try {
            info = connectionResolver.resolve();
        } catch (IllegalArgumentException e) {
            log.warn("Database is not configured: {}", e.getMessage());
            return false;
        }
        return introspector.checkConnection(info);
    }

    public boolean isOracleEnabled() {
        return synthesisClient.isEnabled();
    }

    public boolean cancel() {
        return orchestrator.cancel();
    }

    public GenerationRunTracker.RunStatus status() {
        return runTracker.snapshot();
    }
}
