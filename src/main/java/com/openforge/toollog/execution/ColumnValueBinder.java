package com.openforge.toollog.execution;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Function;

/**
 * Converts a JSON parameter value into a JDBC bind value for a column of the
 * given catalog type, and supplies the matching placeholder.
 *
 *   json / jsonb               → JSON text, bound through CAST(? AS JSONB)
 *   integer / bigint / smallint → Long
 *   real / double / numeric     → Double / BigDecimal
 *   boolean                     → Boolean
 *   anything else               → String (non-text JSON is stored as its JSON text)
 */
final class ColumnValueBinder {

    private ColumnValueBinder() {}

    static String placeholder(String sqlType) {
        return isJson(sqlType) ? "CAST(? AS JSONB)" : "?";
    }

    /**
     * @throws IllegalArgumentException if the value cannot be represented in the column type
     */
    static Object bindValue(JsonNode value, String sqlType) {
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        String type = sqlType == null ? "" : sqlType.toLowerCase(Locale.ROOT);

        if (isJson(type)) return value.toString();

        if (type.startsWith("integer") || type.startsWith("bigint") || type.startsWith("smallint")) {
            if (value.isIntegralNumber() || (value.isNumber() && value.canConvertToExactIntegral())) {
                return value.asLong();
            }
            if (value.isTextual()) return parse(value.asText(), Long::valueOf, type);
            throw mismatch(value, type);
        }

        if (type.startsWith("real") || type.startsWith("double")) {
            if (value.isNumber()) return value.asDouble();
            if (value.isTextual()) return parse(value.asText(), Double::valueOf, type);
            throw mismatch(value, type);
        }

        if (type.startsWith("numeric")) {
            if (value.isNumber()) return value.decimalValue();
            if (value.isTextual()) return parse(value.asText(), BigDecimal::new, type);
            throw mismatch(value, type);
        }

        if (type.startsWith("boolean")) {
            if (value.isBoolean()) return value.asBoolean();
            if (value.isTextual()) {
                String text = value.asText().trim();
                if ("true".equalsIgnoreCase(text))  return Boolean.TRUE;
                if ("false".equalsIgnoreCase(text)) return Boolean.FALSE;
            }
            throw mismatch(value, type);
        }

        return value.isTextual() ? value.asText() : value.toString();
    }

    private static boolean isJson(String sqlType) {
        if (sqlType == null) return false;
        String type = sqlType.toLowerCase(Locale.ROOT);
        return type.startsWith("json");
    }

    private static <T> T parse(String text, Function<String, T> parser, String type) {
        try {
            return parser.apply(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value '%s' is not a valid %s".formatted(text, type), e);
        }
    }

    private static IllegalArgumentException mismatch(JsonNode value, String type) {
        return new IllegalArgumentException("Value %s cannot be stored in a %s column".formatted(value, type));
    }
}
