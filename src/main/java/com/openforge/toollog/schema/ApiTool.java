package com.openforge.toollog.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An external HTTP operation. The OpenAPI document describes exactly one path
 * with one method, e.g.
 * {
 *   "openapi": "3.0.0",
 *   "info": { "title": "Weather", "version": "1.0.0" },
 *   "paths": {
 *     "/forecast": {
 *       "get": { "parameters": [ { "name": "city", "in": "query", "schema": { "type": "string" } } ] }
 *     }
 *   }
 * }
 * Secrets referenced by its security configuration are resolved by the
 * caller before execution; only resolved parameter values reach the logger.
 */
public record ApiTool(
        String id,
        String name,
        JsonNode openapiSpecification
) implements ToolDefinition {

    public ApiTool {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("API tool id must not be null or blank");
        }
    }

    @Override
    public ToolKind kind() {
        return ToolKind.API;
    }
}
