package com.layergen.prompt;

import com.layergen.model.LayerKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-layer generation rules, rendered into {@code {{layer_rules}}}. The rule texts may use the
 * same placeholders as the template.
 */
final class LayerRules {

    private static final Map<LayerKind, String> RULES;

    static {
        Map<LayerKind, String> rules = new EnumMap<>(LayerKind.class);
        rules.put(LayerKind.ENTITY_BASE, String.join("\n",
                "1. Declare the class Base{{class_name}} in package {{package}}.",
                "2. Use UpperCamelCase for the class name and lowerCamelCase for field names.",
                "3. Map every column to a field with a suitable Java type and a comment describing it.",
                "4. Annotate the class with @TableName(\"{{table}}\") and the primary key field with @TableId (MyBatis-Plus).",
                "5. Include all required imports, getters and setters."));
        rules.put(LayerKind.ENTITY_IMPL, String.join("\n",
                "1. Declare the class {{class_name}} in package {{package}}.",
                "2. It extends Base{{class_name}} from the same package and implements java.io.Serializable.",
                "3. Declare no fields and no methods besides serialVersionUID."));
        rules.put(LayerKind.DATA_ACCESS_INTERFACE, String.join("\n",
                "1. Declare the interface {{class_name}}Mapper in package {{package}}.",
                "2. It extends com.baomidou.mybatisplus.core.mapper.BaseMapper<{{class_name}}>.",
                "3. The entity {{class_name}} lives in package {{table_package}}.model.",
                "4. Annotate it with @Mapper."));
        rules.put(LayerKind.SERVICE_INTERFACE, String.join("\n",
                "1. Declare the interface {{class_name}}Service in package {{package}}.",
                "2. It extends com.baomidou.mybatisplus.extension.service.IService<{{class_name}}>.",
                "3. The entity {{class_name}} lives in package {{table_package}}.model."));
        rules.put(LayerKind.SERVICE_IMPL, String.join("\n",
                "1. Declare the class {{class_name}}ServiceImpl in package {{package}}.",
                "2. It extends ServiceImpl<{{class_name}}Mapper, {{class_name}}> and implements {{class_name}}Service.",
                "3. The entity is in {{table_package}}.model, the mapper in {{table_package}}.mapper and the interface in {{table_package}}.service.",
                "4. Annotate the class with @Service and comment each method."));
        rules.put(LayerKind.REQUEST_HANDLER, String.join("\n",
                "1. Declare the class {{class_name}}Controller in package {{package}}.",
                "2. Annotate it with @RestController and @RequestMapping(\"/{{module}}/{{table_suffix}}\").",
                "3. Inject {{class_name}}Service from {{table_package}}.service with @Autowired.",
                "4. Provide RESTful create, read (by id and paged list), update and delete endpoints for {{class_name}}."));
        rules.put(LayerKind.MAPPING_CONFIG, String.join("\n",
                "1. Produce a MyBatis mapper XML document with the mybatis-3-mapper DOCTYPE.",
                "2. The mapper namespace is {{table_package}}.mapper.{{class_name}}Mapper.",
                "3. Declare a resultMap with id BaseResultMap of type {{table_package}}.model.{{class_name}} mapping every column.",
                "4. Declare a sql fragment Base_Column_List listing every column."));
        RULES = Collections.unmodifiableMap(rules);
    }

    private LayerRules() {
    }

    static String forLayer(LayerKind layer) {
        String rules = RULES.get(layer);
        if (rules == null) {
            throw new IllegalArgumentException("No generation rules for layer " + layer);
        }
        return rules;
    }
}
