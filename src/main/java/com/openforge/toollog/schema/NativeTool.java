package com.openforge.toollog.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An internally implemented tool.
 *
 * parameterSchema is a JSON Schema object, e.g.
 * {
 *   "type": "object",
 *   "properties": {
 *     "email": { "type": "string" },
 *     "age":   { "type": "integer" }
 *   },
 *   "required": ["email"]
 * }
 */
public record NativeTool(
        String id,
        String description,
        JsonNode parameterSchema
) implements ToolDefinition {

    public NativeTool {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Native tool id must not be null or blank");
        }
    }

    @Override
    public ToolKind kind() {
        return ToolKind.NATIVE;
    }
}
