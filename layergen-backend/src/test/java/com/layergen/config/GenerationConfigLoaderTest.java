package com.layergen.config;

import com.layergen.model.GenerationConfig;
import com.layergen.model.LayerKind;
import com.layergen.model.TableSelectionPolicy;
import com.layergen.model.WriteMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class GenerationConfigLoaderTest {

    @TempDir
    Path tempDir;

    private GenerationConfig load(String yaml) throws IOException {
        Path file = tempDir.resolve("codegen.yaml");
        Files.writeString(file, yaml);
        return new GenerationConfigLoader(file.toString(), new DefaultResourceLoader()).load();
    }

    @Test
    void loadsPrefixSelectionWithDefaults() throws IOException {
        GenerationConfig config = load(String.join("\n",
                "moduleName: sys",
                "projectRoot: " + tempDir.resolve("out"),
                "tablePrefixes: [sys_, acct_]"));

        assertThat(config.getModuleName()).isEqualTo("sys");
        assertThat(config.getBasePackage()).isEqualTo("com.example");
        assertThat(config.getProjectRoot()).isEqualTo(tempDir.resolve("out").toAbsolutePath());
        assertThat(config.getSelectionPolicy().getMode()).isEqualTo(TableSelectionPolicy.Mode.PREFIXES);
        assertThat(config.getSelectionPolicy().getNames()).containsExactly("sys_", "acct_");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getPromptTemplate()).contains("{{layer_rules}}");
        assertThat(config.getWriteModeOverrides()).isEmpty();
    }

    @Test
    void allowListTakesPrecedenceOverPrefixes() throws IOException {
        GenerationConfig config = load(String.join("\n",
                "moduleName: sys",
                "basePackage: com.xhn",
                "projectRoot: out",
                "tablePrefixes: [sys_]",
                "allowedTables: [sys_menu, sys_role]",
                "parallelism: 2",
                "author: team",
                "writeModes:",
                "  request_handler: preserve"));

        assertThat(config.getSelectionPolicy().getMode()).isEqualTo(TableSelectionPolicy.Mode.ALLOW_LIST);
        assertThat(config.getSelectionPolicy().getNames()).containsExactly("sys_menu", "sys_role");
        assertThat(config.getBasePackage()).isEqualTo("com.xhn");
        assertThat(config.getParallelism()).isEqualTo(2);
        assertThat(config.getAuthor()).isEqualTo("team");
        assertThat(config.getWriteModeOverrides()).containsEntry(LayerKind.REQUEST_HANDLER, WriteMode.PRESERVE);
    }

    @Test
    void customTemplateIsReadFromFile() throws IOException {
        Path template = tempDir.resolve("prompt.txt");
        Files.writeString(template, "Generate {{layer}} for {{table}}");

        GenerationConfig config = load(String.join("\n",
                "moduleName: sys",
                "projectRoot: out",
                "tablePrefixes: [sys_]",
                "promptTemplate: " + template));

        assertThat(config.getPromptTemplate()).isEqualTo("Generate {{layer}} for {{table}}");
    }

    @Test
    void reportsAllProblemsTogether() {
        assertThatThrownBy(() -> load(String.join("\n",
                "moduleName: Sys-Module",
                "parallelism: 0",
                "writeModes:",
                "  controller: sometimes")))
                .isInstanceOf(GenerationConfigException.class)
                .hasMessageContaining("moduleName")
                .hasMessageContaining("projectRoot is required")
                .hasMessageContaining("allowedTables or tablePrefixes")
                .hasMessageContaining("parallelism")
                .hasMessageContaining("invalid writeModes entry");
    }

    @Test
    void missingFileIsAConfigError() {
        GenerationConfigLoader loader = new GenerationConfigLoader(tempDir.resolve("absent.yaml").toString(), new DefaultResourceLoader());

        assertThatThrownBy(loader::load)
                .isInstanceOf(GenerationConfigException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void missingTemplateIsAConfigError() {
        assertThatThrownBy(() -> load(String.join("\n",
                "moduleName: sys",
                "projectRoot: out",
                "tablePrefixes: [sys_]",
                "promptTemplate: " + tempDir.resolve("nope.txt"))))
                .isInstanceOf(GenerationConfigException.class)
                .hasMessageContaining("Prompt template not found");
    }

    @Test
    void unknownKeyIsAConfigError() {
        assertThatThrownBy(() -> load(String.join("\n",
                "moduleName: sys",
                "module_name: sys")))
                .isInstanceOf(GenerationConfigException.class)
                .hasMessageContaining("Failed to read generation config");
    }

    @Test
    void bundledDefaultConfigIsValid() {
        GenerationConfig config = new GenerationConfigLoader("classpath:codegen.yaml", new DefaultResourceLoader()).load();

        assertThat(config.getModuleName()).isEqualTo("sys");
        assertThat(config.getSelectionPolicy().getNames()).containsExactly("sys_");
    }
}
