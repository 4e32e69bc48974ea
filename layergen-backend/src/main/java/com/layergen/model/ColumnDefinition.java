package com.layergen.model;

import lombok.Builder;
import lombok.Value;

/**
 * One column of a table as read from the database catalog.
 */
@Value
@Builder
public class ColumnDefinition {
    String name;

    /**
     * Declared type name as reported by the driver (e.g. {@code varchar}, {@code int8}).
     */
    String type;

    /**
     * Column size, when the driver reports one.
     */
    Integer size;

    boolean nullable;

    boolean primaryKey;

    /**
     * Column comment, empty when the catalog has none.
     */
    @Builder.Default
    String remarks = "";
}
