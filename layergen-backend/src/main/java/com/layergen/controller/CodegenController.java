package com.layergen.controller;

import com.layergen.api.CodegenResponse;
import com.layergen.api.DatabaseInfoResponse;
import com.layergen.api.HealthResponse;
import com.layergen.api.RunStatusResponse;
import com.layergen.api.TableListResponse;
import com.layergen.model.GenerationReport;
import com.layergen.service.CodegenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/codegen")
public class CodegenController {

    private static final Logger log = LoggerFactory.getLogger(CodegenController.class);

    private final CodegenService codegenService;

    public CodegenController(CodegenService codegenService) {
        this.codegenService = codegenService;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean connected = codegenService.checkDatabase();
        HealthResponse response = HealthResponse.builder()
                .status(connected ? "healthy" : "unhealthy")
                .databaseConnected(connected)
                .oracleEnabled(codegenService.isOracleEnabled())
                .generationInProgress(codegenService.status().isInProgress())
                .build();
        return ResponseEntity.status(connected ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @GetMapping("/database")
    public ResponseEntity<DatabaseInfoResponse> database() {
        return ResponseEntity.ok(DatabaseInfoResponse.from(codegenService.describeDatabase()));
    }

    @GetMapping("/tables")
    public ResponseEntity<TableListResponse> tables(@RequestParam(value = "prefix", required = false) String prefix) {
        List<String> tables = codegenService.listTables(prefix);
        return ResponseEntity.ok(new TableListResponse(prefix, tables.size(), tables));
    }

    /**
     * Generate every table selected by the configuration file.
     */
    @GetMapping("/generate")
    public ResponseEntity<CodegenResponse> generateConfigured() {
        GenerationReport report = codegenService.generateConfigured();
        return ResponseEntity.ok(CodegenResponse.from(report));
    }

    /**
     * Generate the tables named in the request body, e.g. {@code ["sys_menu", "sys_role"]}.
     */
    @PostMapping("/generate")
    public ResponseEntity<CodegenResponse> generateSelected(@RequestBody List<String> tables) {
        log.info("Generate request: tables={}", tables);
        GenerationReport report = codegenService.generateTables(tables);
        return ResponseEntity.ok(CodegenResponse.from(report));
    }

    @GetMapping("/status")
    public ResponseEntity<RunStatusResponse> status() {
        return ResponseEntity.ok(RunStatusResponse.from(codegenService.status()));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Boolean>> cancel() {
        return ResponseEntity.ok(Map.of("cancelled", codegenService.cancel()));
    }
}
