package com.openforge.toollog.execution;

import com.openforge.toollog.config.ToolLogProperties;
import com.openforge.toollog.schema.ColumnSpec;
import com.openforge.toollog.schema.IdentifierSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Makes sure a tool's log table exists before a record is written.
 *
 * Check-then-create against the database catalog. Another process may create
 * the same table between the check and the create, so the DDL uses
 * IF NOT EXISTS and "already exists" errors count as success.
 *
 * Table layout:
 * ┌──────────────────┬─────────────┬──────────────────────────────────┐
 * │ Column           │ Type        │ Notes                            │
 * ├──────────────────┼─────────────┼──────────────────────────────────┤
 * │ id               │ BIGSERIAL   │ primary key                      │
 * │ created_at       │ TIMESTAMPTZ │ DEFAULT NOW()                    │
 * │ updated_at       │ TIMESTAMPTZ │ DEFAULT NOW()                    │
 * │ execution_result │ JSONB       │ normalized tool result           │
 * │ <parameter>...   │ mapped      │ one per declared tool parameter  │
 * └──────────────────┴─────────────┴──────────────────────────────────┘
 *
 * Columns are only ever added, never dropped or retyped.
 */
@Slf4j
@Service
public class LogTableProvisioner {

    public static final String RESULT_COLUMN = "execution_result";

    /** JSON Schema type → PostgreSQL type. Anything else is stored as TEXT. */
    static final Map<String, String> TYPE_MAPPING = Map.of(
            "string",  "TEXT",
            "integer", "INTEGER",
            "number",  "REAL",
            "boolean", "BOOLEAN",
            "object",  "JSONB",
            "array",   "JSONB");

    static final String DEFAULT_SQL_TYPE = "TEXT";

    private static final Map<String, String> SYSTEM_COLUMNS = systemColumns();

    static final String TABLE_EXISTS_SQL = """
            SELECT EXISTS (
                SELECT 1 FROM information_schema.tables
                WHERE table_schema = current_schema() AND table_name = ?
            )""";

    static final String TABLE_COLUMNS_SQL = """
            SELECT column_name, data_type FROM information_schema.columns
            WHERE table_schema = current_schema() AND table_name = ?
            ORDER BY ordinal_position""";

    private static final Set<String> ALREADY_EXISTS_STATES = Set.of(
            "42P07",   // duplicate_table
            "42701",   // duplicate_column
            "23505");  // unique_violation on pg_type when two CREATEs race

    private final boolean addMissingColumns;

    /** target cache key + "/" + table name → columns last seen in the catalog. */
    private final Map<String, LogTableSchema> knownTables = new ConcurrentHashMap<>();

    public LogTableProvisioner(ToolLogProperties properties) {
        this.addMissingColumns = properties.schema().addMissingColumns();
    }

    /**
     * Ensures {@code tableName} exists in the target database.
     *
     * @return the table's columns as reported by the catalog
     * @throws com.openforge.toollog.schema.InvalidIdentifierException if the table name is invalid
     */
    public LogTableSchema ensureTable(LogTarget target, JdbcTemplate jdbc,
                                      String tableName, List<ColumnSpec> columns) {
        IdentifierSanitizer.requireValidIdentifier(tableName, "table name");
        String cacheKey = target.cacheKey() + "/" + tableName;

        LogTableSchema known = knownTables.get(cacheKey);
        if (known != null && !needsNewColumns(known, columns)) {
            return known;
        }

        Boolean exists = jdbc.queryForObject(TABLE_EXISTS_SQL, Boolean.class, tableName);
        LogTableSchema planned = plan(tableName, columns);
        if (Boolean.TRUE.equals(exists)) {
            log.debug("[LogTable] Table '{}' confirmed existing in {}.", tableName, target.cacheKey());
            if (addMissingColumns) {
                addMissingColumns(jdbc, planned, readColumns(jdbc, tableName));
            }
        } else {
            log.info("[LogTable] Creating table '{}' in {} with {} parameter column(s).",
                    tableName, target.cacheKey(), planned.columns().size() - SYSTEM_COLUMNS.size());
            executeTolerant(jdbc, createTableSql(planned), tableName);
        }

        LogTableSchema actual = readColumns(jdbc, tableName);
        if (actual.columns().isEmpty()) {
            // catalog not visible to this role; trust what was planned
            actual = planned;
        }
        knownTables.put(cacheKey, actual);
        return actual;
    }

    /** Builds the full column layout for a new table, dropping unusable columns. */
    public LogTableSchema plan(String tableName, List<ColumnSpec> columns) {
        Map<String, String> layout = new LinkedHashMap<>(SYSTEM_COLUMNS);
        for (ColumnSpec column : columns) {
            if (!IdentifierSanitizer.isValidIdentifier(column.name())) {
                log.warn("[LogTable] Invalid identifier for column name: '{}'. Skipping.", column.name());
                continue;
            }
            if (layout.containsKey(column.name())) {
                log.warn("[LogTable] Column '{}' of table '{}' collides with an existing column. Skipping.",
                        column.name(), tableName);
                continue;
            }
            layout.put(column.name(), sqlTypeFor(column.jsonType()));
        }
        return new LogTableSchema(tableName, layout);
    }

    public static String sqlTypeFor(String jsonType) {
        if (jsonType == null) return DEFAULT_SQL_TYPE;
        return TYPE_MAPPING.getOrDefault(jsonType.toLowerCase(Locale.ROOT), DEFAULT_SQL_TYPE);
    }

    static String createTableSql(LogTableSchema planned) {
        List<String> definitions = new ArrayList<>();
        planned.columns().forEach((name, type) -> definitions.add(
                SYSTEM_COLUMNS.containsKey(name) ? name + " " + type : IdentifierSanitizer.quote(name) + " " + type));
        return "CREATE TABLE IF NOT EXISTS %s (%s)".formatted(
                IdentifierSanitizer.quote(planned.tableName()), String.join(", ", definitions));
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private boolean needsNewColumns(LogTableSchema known, List<ColumnSpec> columns) {
        if (!addMissingColumns) return false;
        return columns.stream()
                .map(ColumnSpec::name)
                .filter(IdentifierSanitizer::isValidIdentifier)
                .anyMatch(name -> !known.hasColumn(name));
    }

    private void addMissingColumns(JdbcTemplate jdbc, LogTableSchema planned, LogTableSchema actual) {
        planned.columns().forEach((name, type) -> {
            if (SYSTEM_COLUMNS.containsKey(name) || actual.hasColumn(name)) return;
            log.info("[LogTable] Adding column '{}' {} to table '{}'.", name, type, planned.tableName());
            executeTolerant(jdbc, "ALTER TABLE %s ADD COLUMN IF NOT EXISTS %s %s".formatted(
                    IdentifierSanitizer.quote(planned.tableName()), IdentifierSanitizer.quote(name), type),
                    planned.tableName());
        });
    }

    private LogTableSchema readColumns(JdbcTemplate jdbc, String tableName) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (Map<String, Object> row : jdbc.queryForList(TABLE_COLUMNS_SQL, tableName)) {
            columns.put(String.valueOf(row.get("column_name")), String.valueOf(row.get("data_type")));
        }
        return new LogTableSchema(tableName, columns);
    }

    private void executeTolerant(JdbcTemplate jdbc, String ddl, String tableName) {
        try {
            jdbc.execute(ddl);
        } catch (DataAccessException e) {
            if (!isAlreadyExists(e)) throw e;
            log.info("[LogTable] '{}' was created concurrently ({}). Continuing.", tableName, sqlState(e));
        }
    }

    private static boolean isAlreadyExists(DataAccessException e) {
        String state = sqlState(e);
        return state != null && ALREADY_EXISTS_STATES.contains(state);
    }

    private static String sqlState(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
        }
        return null;
    }

    private static Map<String, String> systemColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("id",          "BIGSERIAL PRIMARY KEY");
        columns.put("created_at",  "TIMESTAMPTZ NOT NULL DEFAULT NOW()");
        columns.put("updated_at",  "TIMESTAMPTZ NOT NULL DEFAULT NOW()");
        columns.put(RESULT_COLUMN, "JSONB");
        return Collections.unmodifiableMap(columns);
    }
}
