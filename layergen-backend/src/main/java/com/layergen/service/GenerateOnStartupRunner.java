package com.layergen.service;

import com.layergen.model.GenerationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot mode: with {@code layergen.run-on-startup=true} the configured generation runs once
 * and the process exits, with status 1 if any task failed or the run could not start.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "layergen.run-on-startup", havingValue = "true")
public class GenerateOnStartupRunner implements CommandLineRunner {

    private final CodegenService codegenService;
    private final ConfigurableApplicationContext context;

    public GenerateOnStartupRunner(CodegenService codegenService, ConfigurableApplicationContext context) {
        this.codegenService = codegenService;
        this.context = context;
    }

    @Override
    public void run(String... args) {
        int exitCode = generateOnce();
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * @return 0 when every task succeeded, 1 otherwise
     */
    int generateOnce() {
        log.info("Running generation on startup...");
        try {
            GenerationReport report = codegenService.generateConfigured();
            return report.isSuccess() ? 0 : 1;
        } catch (RuntimeException e) {
            log.error("Generation on startup failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
