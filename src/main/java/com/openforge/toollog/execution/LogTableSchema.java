package com.openforge.toollog.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A log table and its columns (column name → SQL type), in table order.
 * Used both for the planned CREATE TABLE and for what the catalog reports.
 */
public record LogTableSchema(
        String tableName,
        Map<String, String> columns
) {

    public LogTableSchema {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /** The SQL type of {@code name}, lowercased, or null when absent. */
    public String typeOf(String name) {
        String type = columns.get(name);
        return type == null ? null : type.toLowerCase(Locale.ROOT);
    }
}
