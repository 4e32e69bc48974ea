package com.layergen.config;

import com.layergen.model.GenerationConfig;
import com.layergen.model.LayerKind;
import com.layergen.model.TableSelectionPolicy;
import com.layergen.model.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads the generation YAML and its prompt template into an immutable {@link GenerationConfig}.
 *
 * <p>The file is read on every call so edits take effect on the next run without a restart.
 */
@Component
public class GenerationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(GenerationConfigLoader.class);

    static final String DEFAULT_TEMPLATE = "classpath:prompts/layer-template.txt";

    private static final Pattern PACKAGE_SEGMENT = Pattern.compile("[a-z][a-z0-9_]*");
    private static final Pattern PACKAGE_NAME = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)*");

    private final String configPath;
    private final ResourceLoader resourceLoader;

    public GenerationConfigLoader(
            @Value("${layergen.config-path:classpath:codegen.yaml}") String configPath,
            ResourceLoader resourceLoader
    ) {
        this.configPath = configPath;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Load the configured file.
     *
     * @return validated configuration
     * @throws GenerationConfigException when the file is missing, unreadable or invalid
     */
    public GenerationConfig load() {
        GenerationConfig config = load(resolve(configPath));
        log.info("Loaded generation config: path={}, module={}, root={}, selection={}",
                configPath, config.getModuleName(), config.getProjectRoot(), config.getSelectionPolicy().describe());
        return config;
    }

    GenerationConfig load(Resource resource) {
        if (!resource.exists()) {
            throw new GenerationConfigException("Generation config not found: " + resource.getDescription());
        }
        GenerationConfigFile file;
        try (InputStream in = resource.getInputStream()) {
            file = new Yaml().loadAs(in, GenerationConfigFile.class);
        } catch (IOException | YAMLException e) {
            throw new GenerationConfigException("Failed to read generation config " + resource.getDescription() + ": " + e.getMessage(), e);
        }
        if (file == null) {
            throw new GenerationConfigException("Generation config is empty: " + resource.getDescription());
        }
        return toConfig(file);
    }

    /**
     * Validate a parsed file. Every problem is reported together.
     */
    GenerationConfig toConfig(GenerationConfigFile file) {
        List<String> errors = new ArrayList<>();

        String moduleName = trimToNull(file.getModuleName());
        if (moduleName == null) {
            errors.add("moduleName is required");
        } else if (!PACKAGE_SEGMENT.matcher(moduleName).matches()) {
            errors.add("moduleName must be a lower-case package segment: " + moduleName);
        }

        String basePackage = trimToNull(file.getBasePackage());
        if (basePackage != null && !PACKAGE_NAME.matcher(basePackage).matches()) {
            errors.add("basePackage is not a valid package name: " + basePackage);
        }

        String projectRoot = trimToNull(file.getProjectRoot());
        if (projectRoot == null) {
            errors.add("projectRoot is required");
        }

        TableSelectionPolicy selection = null;
        List<String> allowed = clean(file.getAllowedTables());
        List<String> prefixes = clean(file.getTablePrefixes());
        if (!allowed.isEmpty()) {
            selection = TableSelectionPolicy.allowList(allowed);
        } else if (!prefixes.isEmpty()) {
            selection = TableSelectionPolicy.prefixes(prefixes);
        } else {
            errors.add("either allowedTables or tablePrefixes must list at least one entry");
        }

        int parallelism = file.getParallelism() == null ? 4 : file.getParallelism();
        if (parallelism < 1) {
            errors.add("parallelism must be at least 1");
        }

        Map<LayerKind, WriteMode> overrides = new EnumMap<>(LayerKind.class);
        if (file.getWriteModes() != null) {
            for (Map.Entry<String, String> entry : file.getWriteModes().entrySet()) {
                try {
                    overrides.put(
                            LayerKind.valueOf(entry.getKey().trim().toUpperCase(Locale.ROOT)),
                            WriteMode.valueOf(String.valueOf((Object) entry.getValue()).trim().toUpperCase(Locale.ROOT))
                    );
                } catch (IllegalArgumentException e) {
                    errors.add("invalid writeModes entry: " + entry.getKey() + "=" + entry.getValue());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new GenerationConfigException("Invalid generation config: " + String.join("; ", errors));
        }

        String templateLocation = trimToNull(file.getPromptTemplate());
        GenerationConfig.GenerationConfigBuilder builder = GenerationConfig.builder()
                .moduleName(moduleName)
                .projectRoot(Paths.get(projectRoot).toAbsolutePath().normalize())
                .promptTemplate(readTemplate(templateLocation != null ? templateLocation : DEFAULT_TEMPLATE))
                .selectionPolicy(selection)
                .parallelism(parallelism)
                .writeModeOverrides(overrides);
        if (basePackage != null) {
            builder.basePackage(basePackage);
        }
        String author = trimToNull(file.getAuthor());
        if (author != null) {
            builder.author(author);
        }
        return builder.build();
    }

    private String readTemplate(String location) {
        Resource resource = resolve(location);
        if (!resource.exists()) {
            throw new GenerationConfigException("Prompt template not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            if (text.isBlank()) {
                throw new GenerationConfigException("Prompt template is empty: " + location);
            }
            return text;
        } catch (IOException e) {
            throw new GenerationConfigException("Failed to read prompt template " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * {@code classpath:} and URL locations go through the resource loader; anything else is a file path.
     */
    private Resource resolve(String location) {
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        Path path = Paths.get(location);
        if (!Files.exists(path)) {
            return resourceLoader.getResource("file:" + path.toAbsolutePath());
        }
        return resourceLoader.getResource(path.toUri().toString());
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .distinct()
                .collect(Collectors.toList());
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
