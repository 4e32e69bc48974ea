package com.layergen.service;

import com.layergen.model.GenerationConfig;
import com.layergen.model.LayerKind;
import com.layergen.prompt.PromptBuilder;
import com.layergen.util.TableNaming;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Maps a (table, layer) pair to its file in the target project.
 *
 * <p>Java sources go to {@code src/main/java/<table package>/<layer package>/}; the mapper XML
 * goes to {@code src/main/resources/mapper/<module>/}.
 */
@Component
public class TargetPathResolver {

    public Path resolve(GenerationConfig config, String tableName, LayerKind layer) {
        String fileName = layer.fileName(TableNaming.className(tableName));
        Path root = config.getProjectRoot();
        if (!layer.isJavaSource()) {
            return root.resolve("src/main/resources/mapper")
                    .resolve(config.getModuleName())
                    .resolve(fileName)
                    .normalize();
        }
        String packageName = PromptBuilder.tablePackage(config, tableName) + "." + layer.getSubPackage();
        return root.resolve("src/main/java")
                .resolve(packageName.replace('.', '/'))
                .resolve(fileName)
                .normalize();
    }
}
