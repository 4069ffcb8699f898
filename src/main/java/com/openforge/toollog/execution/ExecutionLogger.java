package com.openforge.toollog.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.openforge.toollog.config.ToolLogProperties;
import com.openforge.toollog.provisioning.ProvisioningException;
import com.openforge.toollog.schema.ApiTool;
import com.openforge.toollog.schema.ColumnSpec;
import com.openforge.toollog.schema.IdentifierSanitizer;
import com.openforge.toollog.schema.NativeTool;
import com.openforge.toollog.schema.ToolDefinition;
import com.openforge.toollog.schema.ToolSchemaExtractor;
import com.openforge.toollog.tenant.TenantKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Records one row per tool execution.
 *
 * Per call, strictly in order:
 *   1. derive + validate the table name          (no remote call on failure)
 *   2. resolve the target database               (tenant → provision on first use)
 *   3. extract columns, ensure the table exists
 *   4. normalize the result                      (zip unwrapping)
 *   5. INSERT with bound values
 *
 * Only declared parameters that exist as table columns and are present in
 * the call are written; anything else is left out of the insert.
 *
 * {@link #logAsync} runs off the caller's thread and reports failures
 * through its future and a WARN log.
 */
@Slf4j
@Service
public class ExecutionLogger {

    private final ToolSchemaExtractor schemaExtractor;
    private final LogTableProvisioner tableProvisioner;
    private final ResultNormalizer    resultNormalizer;
    private final LogTargetResolver   targetResolver;
    private final ObjectMapper        valueMapper;
    private final ExecutorService     executor;
    private final int                 timeoutSeconds;

    public ExecutionLogger(ToolSchemaExtractor schemaExtractor,
                           LogTableProvisioner tableProvisioner,
                           ResultNormalizer resultNormalizer,
                           LogTargetResolver targetResolver,
                           ObjectMapper objectMapper,
                           @Qualifier("toolLogExecutor") ExecutorService executor,
                           ToolLogProperties properties) {
        this.schemaExtractor  = schemaExtractor;
        this.tableProvisioner = tableProvisioner;
        this.resultNormalizer = resultNormalizer;
        this.targetResolver   = targetResolver;
        // logged values keep their own property names; the shared mapper renames to snake_case
        this.valueMapper      = objectMapper.copy().setPropertyNamingStrategy(null);
        this.executor         = executor;
        this.timeoutSeconds   = properties.execution().timeoutSeconds();
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Writes one execution record.
     *
     * @param target     system or tenant database
     * @param tool       the executed tool
     * @param parameters the invocation parameters (JSON object; may be null)
     * @param result     the tool result (may be null)
     * @throws com.openforge.toollog.schema.InvalidIdentifierException if the tool cannot be mapped to a table
     * @throws com.openforge.toollog.provisioning.ControlPlaneConfigurationException if tenant provisioning is not configured
     * @throws ExecutionLogException if provisioning, table creation or the insert fails
     */
    public void log(LogTarget target, ToolDefinition tool, JsonNode parameters, JsonNode result) {
        log(target, tool, parameters, result, null);
    }

    /**
     * Same as {@link #log(LogTarget, ToolDefinition, JsonNode, JsonNode)}, abandoned
     * between steps once {@code deadline} has passed or the calling thread is
     * interrupted. A step already running (a control-plane call, a statement)
     * is bounded by its own timeout; no step starts after the deadline, so no
     * row is written late.
     *
     * @param deadline latest instant at which a step may start; null for none
     * @throws ExecutionLogException if the deadline passes or the thread is interrupted
     */
    public void log(LogTarget target, ToolDefinition tool, JsonNode parameters, JsonNode result,
                    Instant deadline) {
        String tableName = IdentifierSanitizer.requireValidIdentifier(
                schemaExtractor.tableNameFor(tool), "table name for tool " + tool.id());
        try {
            checkpoint(deadline, tool, "resolving the database");
            JdbcTemplate jdbc = targetResolver.resolve(target);

            checkpoint(deadline, tool, "ensuring the log table");
            List<ColumnSpec> declared = schemaExtractor.extract(tool);
            LogTableSchema table = tableProvisioner.ensureTable(target, jdbc, tableName, declared);

            checkpoint(deadline, tool, "normalizing the result");
            JsonNode normalized = resultNormalizer.normalize(result);

            checkpoint(deadline, tool, "inserting the record");
            insert(jdbc, table, declared, parameters, normalized);
        } catch (ProvisioningException e) {
            throw new ExecutionLogException(
                    "Could not provision database for tool '%s': %s".formatted(tool.id(), e.getMessage()), e);
        } catch (DataAccessException e) {
            throw new ExecutionLogException(
                    "Could not write execution record for tool '%s' into '%s'".formatted(tool.id(), tableName), e);
        }
    }

    /** Map-based variant for callers holding parameters as plain Java values. */
    public void logValues(LogTarget target, ToolDefinition tool, Map<String, ?> parameters, Object result) {
        log(target, tool, toTree(parameters), toTree(result));
    }

    /** Native tool executions are logged in the system database. */
    public void logNative(NativeTool tool, JsonNode parameters, JsonNode result) {
        log(LogTarget.system(), tool, parameters, result);
    }

    /** API tool executions are logged in the calling tenant's own database. */
    public void logApi(TenantKey tenant, ApiTool tool, JsonNode parameters, JsonNode result) {
        log(LogTarget.tenant(tenant), tool, parameters, result);
    }

    /**
     * Fire-and-report: runs {@link #log} on the logging executor, bounded by
     * {@code toollog.execution.timeout-seconds}. Failures are logged here and
     * complete the returned future exceptionally; they never reach the tool
     * invocation unless the caller chooses to join.
     *
     * When the timeout fires, or the caller cancels the returned future, the
     * running task is interrupted and stops before its next step.
     */
    public CompletableFuture<Void> logAsync(LogTarget target, ToolDefinition tool,
                                            JsonNode parameters, JsonNode result) {
        Instant deadline = Instant.now().plusSeconds(timeoutSeconds);
        CompletableFuture<Void> completion = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                log(target, tool, parameters, result, deadline);
                completion.complete(null);
            } catch (RuntimeException e) {
                completion.completeExceptionally(e);
            }
        });

        completion.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .whenComplete((ignored, error) -> {
                    if (error == null) return;
                    task.cancel(true);
                    log.warn("[ExecLog] Failed to log execution of tool '{}' ({}): {}",
                            tool.id(), target.scope(), error.toString());
                });
        return completion;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void insert(JdbcTemplate jdbc, LogTableSchema table, List<ColumnSpec> declared,
                        JsonNode parameters, JsonNode result) {
        List<String> columns      = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        List<Object> values       = new ArrayList<>();

        columns.add(IdentifierSanitizer.quote(LogTableProvisioner.RESULT_COLUMN));
        placeholders.add(ColumnValueBinder.placeholder("jsonb"));
        values.add(result == null || result.isNull() ? null : serialize(result));

        for (String name : writableColumns(table, declared)) {
            JsonNode value = parameters == null ? MissingNode.getInstance() : parameters.path(name);
            if (value.isMissingNode()) continue;
            String sqlType = table.typeOf(name);
            try {
                values.add(ColumnValueBinder.bindValue(value, sqlType));
            } catch (IllegalArgumentException e) {
                throw new ExecutionLogException("Parameter '%s' of table '%s': %s"
                        .formatted(name, table.tableName(), e.getMessage()), e);
            }
            columns.add(IdentifierSanitizer.quote(name));
            placeholders.add(ColumnValueBinder.placeholder(sqlType));
        }

        String sql = "INSERT INTO %s (%s) VALUES (%s)".formatted(
                IdentifierSanitizer.quote(table.tableName()),
                String.join(", ", columns),
                String.join(", ", placeholders));
        jdbc.update(sql, values.toArray());
        log.debug("[ExecLog] Logged execution into '{}' ({} column(s)).", table.tableName(), columns.size());
    }

    /** Declared, valid parameter names that the table actually has, in declaration order. */
    private static void checkpoint(Instant deadline, ToolDefinition tool, String step) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ExecutionLogException(
                    "Logging of tool '%s' interrupted before %s".formatted(tool.id(), step));
        }
        if (deadline != null && Instant.now().isAfter(deadline)) {
            throw new ExecutionLogException(
                    "Logging of tool '%s' passed its deadline before %s".formatted(tool.id(), step));
        }
    }

    private Set<String> writableColumns(LogTableSchema table, List<ColumnSpec> declared) {
        Set<String> names = new LinkedHashSet<>();
        for (ColumnSpec column : declared) {
            String name = column.name();
            if (!IdentifierSanitizer.isValidIdentifier(name)
                    || LogTableProvisioner.RESULT_COLUMN.equals(name)) continue;
            if (!table.hasColumn(name)) {
                log.debug("[ExecLog] Table '{}' has no column '{}'. Omitting value.", table.tableName(), name);
                continue;
            }
            names.add(name);
        }
        return names;
    }

    private String serialize(JsonNode node) {
        try {
            return valueMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ExecutionLogException("Failed to serialize execution result", e);
        }
    }

    private JsonNode toTree(Object value) {
        return value == null ? null : valueMapper.valueToTree(value);
    }
}
