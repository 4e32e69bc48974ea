package com.layergen.service;

import com.layergen.model.GenerationConfig;
import com.layergen.model.GenerationReport;
import com.layergen.model.GenerationTask;
import com.layergen.model.LayerKind;
import com.layergen.model.LayerOutcome;
import com.layergen.model.TableReport;
import com.layergen.model.TableSchema;
import com.layergen.model.TaskStage;
import com.layergen.model.WriteMode;
import com.layergen.oracle.CodeSynthesisClient;
import com.layergen.oracle.CodeSynthesisException;
import com.layergen.oracle.SynthesisResult;
import com.layergen.prompt.OracleRequest;
import com.layergen.prompt.PromptBuilder;
import com.layergen.schema.SchemaIntrospector;
import com.layergen.util.JdbcConnectionInfo;
import com.layergen.web.TraceIdFilter;
import com.layergen.writer.DurableFileWriter;
import com.layergen.writer.WriteFailureException;
import com.layergen.writer.WriteOutcome;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the pipeline: introspect once, then prompt, synthesize and write every (table, layer)
 * task on a bounded worker pool.
 *
 * <p>A failing task is recorded in the report and never stops its siblings. Only a schema
 * connection failure aborts a run, and it happens before any file is touched.
 */
@Slf4j
@Service
public class GenerationOrchestrator {

    private final SchemaIntrospector introspector;
    private final PromptBuilder promptBuilder;
    private final CodeSynthesisClient synthesisClient;
    private final DurableFileWriter fileWriter;
    private final TargetPathResolver pathResolver;
    private final GenerationRunTracker runTracker;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunContext current;

    public GenerationOrchestrator(
            SchemaIntrospector introspector,
            PromptBuilder promptBuilder,
            CodeSynthesisClient synthesisClient,
            DurableFileWriter fileWriter,
            TargetPathResolver pathResolver,
            GenerationRunTracker runTracker
    ) {
        this.introspector = introspector;
        this.promptBuilder = promptBuilder;
        this.synthesisClient = synthesisClient;
        this.fileWriter = fileWriter;
        this.pathResolver = pathResolver;
        this.runTracker = runTracker;
    }

    /**
     * Execute one run.
     *
     * @param connection schema source
     * @param config run configuration
     * @return the report; check {@link GenerationReport#isSuccess()}
     * @throws com.layergen.schema.SchemaConnectionException if the schema cannot be read
     * @throws GenerationInProgressException if another run is active
     */
    public GenerationReport run(JdbcConnectionInfo connection, GenerationConfig config) {
        if (!running.compareAndSet(false, true)) {
            throw new GenerationInProgressException("A generation run is already in progress");
        }
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = Instant.now();
        RunContext ctx = new RunContext(runId);
        current = ctx;
        runTracker.markStarted(runId, startedAt);
        try {
            log.info("Generation run started: run_id={}, module={}, root={}, selection={}",
                    runId, config.getModuleName(), config.getProjectRoot(), config.getSelectionPolicy().describe());

            List<TableSchema> tables = introspector.introspect(connection, config.getSelectionPolicy());

            GenerationReport.GenerationReportBuilder report = GenerationReport.builder()
                    .runId(runId)
                    .startedAt(startedAt);
            if (tables.isEmpty()) {
                log.warn("No table matched the selection: run_id={}, selection={}", runId, config.getSelectionPolicy().describe());
                return finish(report.selectionEmpty(true).cancelled(ctx.cancelled.get()));
            }

            fileWriter.sweepStaleTempFiles(config.getProjectRoot());

            List<PlannedTask> plan = plan(tables, config);
            Map<PlannedTask, LayerOutcome> outcomes = execute(plan, config, ctx);

            Map<String, List<LayerOutcome>> byTable = new LinkedHashMap<>();
            for (PlannedTask planned : plan) {
                byTable.computeIfAbsent(planned.task.getTable().getName(), k -> new ArrayList<>())
                        .add(outcomes.get(planned));
            }
            byTable.forEach((table, layers) -> report.table(new TableReport(table, layers)));
            return finish(report.cancelled(ctx.cancelled.get()));
        } catch (RuntimeException e) {
            runTracker.markAborted(runId, e.getMessage());
            log.error("Generation run aborted: run_id={}, error={}", runId, e.getMessage());
            throw e;
        } finally {
            current = null;
            running.set(false);
        }
    }

    /**
     * Ask the active run to stop. Tasks that have not started are reported cancelled; a task
     * already writing finishes its write.
     *
     * @return whether a run was active
     */
    public boolean cancel() {
        RunContext ctx = current;
        if (ctx == null) {
            return false;
        }
        if (ctx.cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested: run_id={}", ctx.runId);
            ExecutorService executor = ctx.executor;
            if (executor != null) {
                executor.shutdown();
            }
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private GenerationReport finish(GenerationReport.GenerationReportBuilder builder) {
        GenerationReport report = builder.finishedAt(Instant.now()).build();
        if (report.isSuccess()) {
            log.info(report.toSummaryText());
        } else {
            log.warn(report.toSummaryText());
        }
        runTracker.markFinished(report);
        return report;
    }

    /**
     * Build tasks in report order. A task whose target path is already claimed by an earlier
     * task is failed here and never dispatched.
     */
    private List<PlannedTask> plan(List<TableSchema> tables, GenerationConfig config) {
        WriteModePolicy policy = WriteModePolicy.withOverrides(config.getWriteModeOverrides());
        Set<Path> claimed = new HashSet<>();
        List<PlannedTask> plan = new ArrayList<>();
        for (TableSchema table : tables) {
            for (LayerKind layer : LayerKind.values()) {
                Path target = pathResolver.resolve(config, table.getName(), layer);
                GenerationTask task = new GenerationTask(table, layer, target, policy.modeFor(layer));
                if (!claimed.add(target)) {
                    log.warn("Target path already claimed: {}, path={}", task.describe(), target);
                    plan.add(new PlannedTask(task, LayerOutcome.failed(task, TaskStage.PROMPTING, "PATH_COLLISION",
                            "target path already claimed by another task: " + target, 0)));
                } else {
                    plan.add(new PlannedTask(task, null));
                }
            }
        }
        return plan;
    }

    private Map<PlannedTask, LayerOutcome> execute(List<PlannedTask> plan, GenerationConfig config, RunContext ctx) {
        Map<PlannedTask, LayerOutcome> outcomes = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism(), new WorkerThreadFactory(ctx.runId));
        ctx.executor = executor;
        try {
            Map<PlannedTask, Future<LayerOutcome>> futures = new LinkedHashMap<>();
            for (PlannedTask planned : plan) {
                if (planned.preFailed != null) {
                    outcomes.put(planned, planned.preFailed);
                } else if (ctx.cancelled.get()) {
                    outcomes.put(planned, LayerOutcome.cancelled(planned.task));
                } else {
                    try {
                        futures.put(planned, executor.submit(() -> executeTask(planned.task, config, ctx, planned.stage)));
                    } catch (RejectedExecutionException e) {
                        // cancel() shut the pool down while tasks were still being submitted
                        outcomes.put(planned, LayerOutcome.cancelled(planned.task));
                    }
                }
            }
            boolean interrupted = false;
            for (Map.Entry<PlannedTask, Future<LayerOutcome>> entry : futures.entrySet()) {
                while (true) {
                    try {
                        outcomes.put(entry.getKey(), entry.getValue().get());
                        break;
                    } catch (InterruptedException e) {
                        // Stop dispatching, but let started writes finish before returning.
                        interrupted = true;
                        ctx.cancelled.set(true);
                    } catch (ExecutionException e) {
                        PlannedTask planned = entry.getKey();
                        TaskStage stage = planned.stage.get();
                        log.error("Task crashed: {}, stage={}", planned.task.describe(), stage, e.getCause());
                        outcomes.put(planned, LayerOutcome.failed(planned.task, stage, "INTERNAL_ERROR",
                                String.valueOf(e.getCause()), 0));
                        break;
                    }
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        } finally {
            executor.shutdown();
            ctx.executor = null;
        }
        return outcomes;
    }

    LayerOutcome executeTask(GenerationTask task, GenerationConfig config, RunContext ctx, AtomicReference<TaskStage> stage) {
        MDC.put(TraceIdFilter.MDC_TRACE_ID, ctx.runId);
        try {
            return runStages(task, config, ctx, stage);
        } finally {
            MDC.remove(TraceIdFilter.MDC_TRACE_ID);
        }
    }

    private LayerOutcome runStages(GenerationTask task, GenerationConfig config, RunContext ctx, AtomicReference<TaskStage> stage) {
        stage.set(TaskStage.PROMPTING);
        if (ctx.cancelled.get()) {
            return LayerOutcome.cancelled(task);
        }
        if (task.getWriteMode() == WriteMode.PRESERVE && Files.exists(task.getTargetPath())) {
            log.info("Preserved existing file: {}, path={}", task.describe(), task.getTargetPath());
            return LayerOutcome.preserved(task, 0);
        }
        OracleRequest request;
        try {
            request = promptBuilder.build(task.getTable(), task.getLayer(), config);
        } catch (RuntimeException e) {
            log.warn("Prompt rendering failed: {}, error={}", task.describe(), e.getMessage());
            return LayerOutcome.failed(task, TaskStage.PROMPTING, "PROMPT_ERROR", e.getMessage(), 0);
        }

        stage.set(TaskStage.SYNTHESIZING);
        if (ctx.cancelled.get()) {
            return LayerOutcome.cancelled(task);
        }
        SynthesisResult result;
        try {
            result = synthesisClient.synthesize(request);
        } catch (CodeSynthesisException e) {
            log.warn("Synthesis failed: {}, kind={}, attempts={}, error={}",
                    task.describe(), e.getFailureKind(), e.getAttempts(), e.getMessage());
            return LayerOutcome.failed(task, TaskStage.SYNTHESIZING, e.getFailureKind(),
                    e.getFailureKind() + " " + e.getMessage(), e.getAttempts());
        }

        stage.set(TaskStage.WRITING);
        if (ctx.cancelled.get()) {
            return LayerOutcome.cancelled(task);
        }
        String content = result.code().endsWith("\n") ? result.code() : result.code() + "\n";
        try {
            WriteOutcome written = task.getWriteMode() == WriteMode.OVERWRITE
                    ? fileWriter.writeOverwriteAtomic(task.getTargetPath(), content)
                    : fileWriter.writeIfNotExists(task.getTargetPath(), content);
            if (written == WriteOutcome.SKIPPED_PRESERVED) {
                log.info("Preserved existing file: {}, path={}", task.describe(), task.getTargetPath());
                return LayerOutcome.preserved(task, result.attempts());
            }
            log.info("Generated: {}, path={}, attempts={}", task.describe(), task.getTargetPath(), result.attempts());
            return LayerOutcome.generated(task, result.attempts());
        } catch (WriteFailureException e) {
            log.warn("Write failed: {}, path={}, error={}", task.describe(), e.getPath(), e.getMessage(), e);
            return LayerOutcome.failed(task, TaskStage.WRITING, "WRITE_FAILED",
                    e.getMessage() + (e.getCause() != null ? " (" + e.getCause() + ")" : ""), result.attempts());
        }
    }

    static final class RunContext {
        final String runId;
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        volatile ExecutorService executor;

        RunContext(String runId) {
            this.runId = runId;
        }
    }

    private static final class PlannedTask {
        final GenerationTask task;
        final LayerOutcome preFailed;
        final AtomicReference<TaskStage> stage = new AtomicReference<>(TaskStage.PROMPTING);

        PlannedTask(GenerationTask task, LayerOutcome preFailed) {
            this.task = task;
            this.preFailed = preFailed;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String runId;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String runId) {
            this.runId = runId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "layergen-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
