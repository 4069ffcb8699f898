package com.openforge.toollog.schema;

/** Discriminant of {@link ToolDefinition}. */
public enum ToolKind {
    /** Implemented in-process; parameters described by a JSON Schema object. */
    NATIVE,
    /** An external HTTP operation described by an OpenAPI document. */
    API
}
