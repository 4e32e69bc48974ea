package com.layergen.prompt;

import com.layergen.model.ColumnDefinition;
import com.layergen.model.GenerationConfig;
import com.layergen.model.LayerKind;
import com.layergen.model.TableSchema;
import com.layergen.util.TableNaming;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the oracle request for one table and one layer.
 *
 * <p>Rendering is a pure function of its arguments: no clock, no randomness, columns in catalog
 * order. Re-running generation on an unchanged schema therefore sends byte-identical requests.
 */
@Component
public class PromptBuilder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-z_]+)}}");

    private static final String SYSTEM_PROMPT = String.join("\n",
            "You are a senior Java backend engineer who follows the Java coding conventions.",
            "The project uses Spring Boot and MyBatis-Plus on a relational database.",
            "Each request asks for exactly one layer of one table.",
            "Reply with exactly one fenced code block (```%s ... ```) containing only the code of that layer.",
            "Do not add explanations, additional code blocks or text outside the block.");

    /**
     * Render the request.
     *
     * @param table table snapshot
     * @param layer layer to generate
     * @param config run configuration supplying the template and naming inputs
     * @return rendered request
     */
    public OracleRequest build(TableSchema table, LayerKind layer, GenerationConfig config) {
        Map<String, String> values = placeholders(table, layer, config);
        values.put("layer_rules", render(LayerRules.forLayer(layer), values));
        String userPrompt = render(config.getPromptTemplate(), values);
        String systemPrompt = String.format(SYSTEM_PROMPT, layer.getFenceLanguage());
        return new OracleRequest(layer, systemPrompt, userPrompt, layer.getFenceLanguage());
    }

    /**
     * Package of the generated code of a table, e.g. {@code com.example.sys.menu}.
     */
    public static String tablePackage(GenerationConfig config, String tableName) {
        return config.getBasePackage() + "." + config.getModuleName() + "." + TableNaming.tableSuffix(tableName);
    }

    private Map<String, String> placeholders(TableSchema table, LayerKind layer, GenerationConfig config) {
        String tablePackage = tablePackage(config, table.getName());
        String layerPackage = layer.isJavaSource()
                ? tablePackage + "." + layer.getSubPackage()
                : tablePackage + ".mapper";

        Map<String, String> values = new LinkedHashMap<>();
        values.put("module", config.getModuleName());
        values.put("base_package", config.getBasePackage());
        values.put("table", table.getName());
        values.put("table_comment", table.getRemarks());
        values.put("class_name", TableNaming.className(table.getName()));
        values.put("table_suffix", TableNaming.tableSuffix(table.getName()));
        values.put("table_package", tablePackage);
        values.put("package", layerPackage);
        values.put("layer", layer.getDisplayName());
        values.put("fence_language", layer.getFenceLanguage());
        values.put("author", config.getAuthor());
        values.put("columns", renderColumns(table));
        values.put("primary_key", table.getPrimaryKey()
                .map(ColumnDefinition::getName)
                .orElse("none detected"));
        return values;
    }

    private String renderColumns(TableSchema table) {
        StringBuilder sb = new StringBuilder();
        for (ColumnDefinition c : table.getColumns()) {
            if (sb.length() > 0) {
                sb.append("\n");
            }
            sb.append("- ").append(c.getName())
                    .append(" | ").append(c.getType());
            if (c.getSize() != null && c.getSize() > 0) {
                sb.append("(").append(c.getSize()).append(")");
            }
            sb.append(" | ").append(c.isNullable() ? "NULL" : "NOT NULL");
            if (c.isPrimaryKey()) {
                sb.append(" | PRIMARY KEY");
            }
            if (c.getRemarks() != null && !c.getRemarks().isBlank()) {
                sb.append(" | ").append(c.getRemarks().trim());
            }
        }
        return sb.toString();
    }

    /**
     * Substitute {@code {{name}}} placeholders; unknown names are kept verbatim.
     */
    static String render(String template, Map<String, String> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
