package com.openforge.toollog.schema;

/** One tool parameter as a log-table column: its name and JSON Schema type (null when undeclared). */
public record ColumnSpec(
        String name,
        String jsonType
) {

    public static ColumnSpec of(String name, String jsonType) {
        return new ColumnSpec(name, jsonType);
    }
}
