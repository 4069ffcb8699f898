package com.openforge.toollog.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes the parameter declarations of a tool into an ordered column list.
 *
 *   NATIVE  → parameterSchema.properties, in declared order
 *   API     → parameters[] of the single path / single method of the OpenAPI document
 *
 * A native parameter without a recognizable type keeps its column with a null
 * type (stored as TEXT); an API parameter without name or type is skipped. A
 * tool without parameters yields an empty list.
 */
@Slf4j
@Component
public class ToolSchemaExtractor {

    public static final String TABLE_PREFIX = "tool_";

    public List<ColumnSpec> extract(ToolDefinition tool) {
        return switch (tool.kind()) {
            case NATIVE -> extractNative((NativeTool) tool);
            case API    -> extractApi((ApiTool) tool);
        };
    }

    /**
     * Log-table name for a tool: {@code tool_<id>} for native tools,
     * {@code tool_<title>_<version>} slugged from the OpenAPI {@code info}
     * block for API tools (falling back to the tool id). The result is not
     * validated here.
     */
    public String tableNameFor(ToolDefinition tool) {
        return switch (tool.kind()) {
            case NATIVE -> TABLE_PREFIX + tool.id();
            case API    -> TABLE_PREFIX + apiSlug((ApiTool) tool);
        };
    }

    // ── Native tools ─────────────────────────────────────────────────────────

    private List<ColumnSpec> extractNative(NativeTool tool) {
        List<ColumnSpec> columns = new ArrayList<>();
        JsonNode properties = tool.parameterSchema() == null ? null : tool.parameterSchema().get("properties");
        if (properties == null || !properties.isObject()) return columns;

        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String type = typeOf(field.getValue());
            if (type == null) {
                log.debug("[Schema] Tool '{}' parameter '{}' has no recognizable type. Stored as text.",
                        tool.id(), field.getKey());
            }
            columns.add(ColumnSpec.of(field.getKey(), type));
        }
        return columns;
    }

    // ── API tools ────────────────────────────────────────────────────────────

    private List<ColumnSpec> extractApi(ApiTool tool) {
        List<ColumnSpec> columns = new ArrayList<>();
        JsonNode operation = singleOperation(tool);
        if (operation == null) return columns;

        JsonNode parameters = operation.get("parameters");
        if (parameters == null || !parameters.isArray()) return columns;

        for (JsonNode parameter : parameters) {
            JsonNode name = parameter.get("name");
            String type = typeOf(parameter.get("schema"));
            if (name == null || !name.isTextual() || name.asText().isEmpty() || type == null) {
                log.debug("[Schema] Tool '{}' has a parameter without name or type. Skipping: {}",
                        tool.id(), parameter);
                continue;
            }
            columns.add(ColumnSpec.of(name.asText(), type));
        }
        return columns;
    }

    /** The first method of the first path, or null when the document has none. */
    private JsonNode singleOperation(ApiTool tool) {
        JsonNode spec = tool.openapiSpecification();
        JsonNode paths = spec == null ? null : spec.get("paths");
        if (paths == null || !paths.isObject() || paths.isEmpty()) {
            log.warn("[Schema] No path found in OpenAPI document of tool '{}'.", tool.id());
            return null;
        }
        if (paths.size() > 1) {
            log.warn("[Schema] Tool '{}' declares {} paths; only the first is used.", tool.id(), paths.size());
        }
        JsonNode pathItem = paths.elements().next();
        if (pathItem == null || !pathItem.isObject() || pathItem.isEmpty()) {
            log.warn("[Schema] No operation found in OpenAPI document of tool '{}'.", tool.id());
            return null;
        }
        JsonNode operation = pathItem.elements().next();
        return operation.isObject() ? operation : null;
    }

    private static String apiSlug(ApiTool tool) {
        JsonNode info = tool.openapiSpecification() == null ? null : tool.openapiSpecification().get("info");
        String title   = info == null ? null : info.path("title").asText(null);
        String version = info == null ? null : info.path("version").asText(null);

        String slug = slug(title);
        if (slug.isEmpty()) return slug(tool.id());
        String versionSlug = slug(version);
        return versionSlug.isEmpty() ? slug : slug + "_" + versionSlug;
    }

    static String slug(String value) {
        if (value == null) return "";
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return slug.replaceAll("^_+|_+$", "");
    }

    /**
     * Reads {@code type} from a schema node. A union such as ["string", "null"]
     * resolves to its first non-null member.
     */
    private static String typeOf(JsonNode schema) {
        if (schema == null || !schema.isObject()) return null;
        JsonNode type = schema.get("type");
        if (type == null) return null;
        if (type.isTextual()) return type.asText();
        if (type.isArray()) {
            for (JsonNode member : type) {
                if (member.isTextual() && !"null".equals(member.asText())) return member.asText();
            }
        }
        return null;
    }
}
