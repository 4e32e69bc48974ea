package com.layergen.controller;

import com.layergen.config.GenerationConfigException;
import com.layergen.model.GenerationReport;
import com.layergen.model.GenerationTask;
import com.layergen.model.LayerKind;
import com.layergen.model.LayerOutcome;
import com.layergen.model.TableReport;
import com.layergen.model.TableSchema;
import com.layergen.model.TaskStage;
import com.layergen.model.WriteMode;
import com.layergen.schema.DatabaseInfo;
import com.layergen.schema.SchemaConnectionException;
import com.layergen.service.CodegenService;
import com.layergen.service.GenerationInProgressException;
import com.layergen.service.GenerationRunTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CodegenController.class)
class CodegenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CodegenService codegenService;

    private GenerationReport partialReport() {
        TableSchema role = TableSchema.builder().name("sys_role").build();
        GenerationTask base = new GenerationTask(role, LayerKind.ENTITY_BASE, Path.of("/out/BaseSysRole.java"), WriteMode.OVERWRITE);
        GenerationTask xml = new GenerationTask(role, LayerKind.MAPPING_CONFIG, Path.of("/out/SysRoleMapper.xml"), WriteMode.OVERWRITE);
        return GenerationReport.builder()
                .runId("run1")
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .finishedAt(Instant.parse("2024-05-01T10:00:03Z"))
                .table(new TableReport("sys_menu", List.of(LayerOutcome.generated(base, 1))))
                .table(new TableReport("sys_role", List.of(
                        LayerOutcome.generated(base, 1),
                        LayerOutcome.failed(xml, TaskStage.SYNTHESIZING, "MALFORMED_RESPONSE", "MALFORMED_RESPONSE no block", 1))))
                .build();
    }

    @Test
    void generateConfiguredReturnsSnakeCaseReport() throws Exception {
        when(codegenService.generateConfigured()).thenReturn(partialReport());

        mockMvc.perform(get("/api/codegen/generate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.total_tables").value(2))
                .andExpect(jsonPath("$.generated_tables", contains("sys_menu")))
                .andExpect(jsonPath("$.failed_tables", contains("sys_role")))
                .andExpect(jsonPath("$.duration_ms").value(3000))
                .andExpect(jsonPath("$.tables[1].layers[1].status").value("failed"))
                .andExpect(jsonPath("$.tables[1].layers[1].failure_kind").value("MALFORMED_RESPONSE"))
                .andExpect(jsonPath("$.tables[1].layers[1].stage").value("SYNTHESIZING"));
    }

    @Test
    void generateSelectedPassesTableNames() throws Exception {
        when(codegenService.generateTables(anyList())).thenReturn(GenerationReport.builder().runId("r").build());

        mockMvc.perform(post("/api/codegen/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[\"sys_menu\",\"sys_role\"]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(codegenService).generateTables(List.of("sys_menu", "sys_role"));
    }

    @Test
    void emptyTableListIsBadRequest() throws Exception {
        when(codegenService.generateTables(anyList())).thenThrow(new IllegalArgumentException("Table list must not be empty"));

        mockMvc.perform(post("/api/codegen/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]")
                        .header("X-Request-Id", "req-42"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Request-Id", "req-42"))
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.trace_id").value("req-42"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/codegen/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tables\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST_BODY"));
    }

    @Test
    void concurrentRunIsConflict() throws Exception {
        when(codegenService.generateConfigured()).thenThrow(new GenerationInProgressException("A generation run is already in progress"));

        mockMvc.perform(get("/api/codegen/generate"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("GENERATION_IN_PROGRESS"));
    }

    @Test
    void schemaAndConfigFailuresAreMapped() throws Exception {
        when(codegenService.generateConfigured())
                .thenThrow(new SchemaConnectionException("Failed to connect", new RuntimeException("refused")))
                .thenThrow(new GenerationConfigException("moduleName is required"));

        mockMvc.perform(get("/api/codegen/generate"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("DATABASE_UNAVAILABLE"))
                .andExpect(header().exists("X-Request-Id"));
        mockMvc.perform(get("/api/codegen/generate"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("CONFIG_ERROR"));
    }

    @Test
    void healthReflectsDatabaseState() throws Exception {
        when(codegenService.checkDatabase()).thenReturn(true, false);
        when(codegenService.isOracleEnabled()).thenReturn(true);
        when(codegenService.status()).thenReturn(GenerationRunTracker.RunStatus.builder().build());

        mockMvc.perform(get("/api/codegen/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.oracle_enabled").value(true));
        mockMvc.perform(get("/api/codegen/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.database_connected").value(false));
    }

    @Test
    void tablesAreListedWithPrefix() throws Exception {
        when(codegenService.listTables("sys_")).thenReturn(List.of("sys_menu", "sys_role"));

        mockMvc.perform(get("/api/codegen/tables").param("prefix", "sys_"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.tables", contains("sys_menu", "sys_role")));
    }

    @Test
    void databaseInfoNeverIncludesPassword() throws Exception {
        when(codegenService.describeDatabase()).thenReturn(DatabaseInfo.builder()
                .url("jdbc:postgresql://db:5432/app")
                .dbType("postgres")
                .username("codegen")
                .connected(true)
                .productName("PostgreSQL")
                .productVersion("16.2")
                .build());

        mockMvc.perform(get("/api/codegen/database"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user").value("codegen"))
                .andExpect(jsonPath("$.version").value("16.2"))
                .andExpect(jsonPath("$.password").doesNotExist());
    }

    @Test
    void statusAndCancel() throws Exception {
        when(codegenService.status()).thenReturn(GenerationRunTracker.RunStatus.builder()
                .inProgress(true)
                .currentRunId("run9")
                .lastRunSuccess(false)
                .build());
        when(codegenService.cancel()).thenReturn(true);

        mockMvc.perform(get("/api/codegen/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.in_progress").value(true))
                .andExpect(jsonPath("$.current_run_id").value("run9"))
                .andExpect(jsonPath("$.last_run_success").value(false));
        mockMvc.perform(post("/api/codegen/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
        verify(codegenService, never()).generateConfigured();
        verify(codegenService, never()).generateTables(any());
    }
}
