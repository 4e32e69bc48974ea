package com.layergen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a table's structure, read once per generation run.
 *
 * <p>Composite primary keys are represented as "no primary key": none of the columns carries
 * the primary-key flag in that case.
 */
@Value
@Builder
public class TableSchema {
    String name;

    @Singular
    List<ColumnDefinition> columns;

    @Builder.Default
    String remarks = "";

    public Optional<ColumnDefinition> getPrimaryKey() {
        return columns.stream().filter(ColumnDefinition::isPrimaryKey).findFirst();
    }
}
