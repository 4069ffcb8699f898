package com.openforge.toollog.execution;

import com.openforge.toollog.config.ToolLogProperties;
import com.openforge.toollog.schema.ColumnSpec;
import com.openforge.toollog.schema.InvalidIdentifierException;
import com.openforge.toollog.tenant.TenantKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.jdbc.BadSqlGrammarException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogTableProvisionerTest {

    private static final List<ColumnSpec> EMAIL_AGE = List.of(
            ColumnSpec.of("email", "string"),
            ColumnSpec.of("age", "integer"));

    private final RecordingJdbcTemplate jdbc = new RecordingJdbcTemplate();
    private final LogTableProvisioner provisioner = new LogTableProvisioner(ToolLogProperties.defaults());

    @Test
    void createsTableWithSystemAndParameterColumns() {
        LogTableSchema schema = provisioner.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE);

        assertThat(jdbc.ddl).containsExactly("CREATE TABLE IF NOT EXISTS \"tool_send_email\" ("
                + "id BIGSERIAL PRIMARY KEY, "
                + "created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), "
                + "updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), "
                + "execution_result JSONB, "
                + "\"email\" TEXT, "
                + "\"age\" INTEGER)");
        assertThat(schema.columns().keySet())
                .containsExactly("id", "created_at", "updated_at", "execution_result", "email", "age");
        assertThat(schema.typeOf("age")).isEqualTo("integer");
    }

    @Test
    void secondCallIsServedFromCache() {
        provisioner.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE);
        int queriesAfterFirst = jdbc.queries.size();

        provisioner.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE);

        assertThat(jdbc.createStatements()).isEqualTo(1);
        assertThat(jdbc.queries).hasSize(queriesAfterFirst);
    }

    @Test
    void cacheIsKeptPerTarget() {
        RecordingJdbcTemplate tenantJdbc = new RecordingJdbcTemplate();
        provisioner.ensureTable(LogTarget.system(), jdbc, "tool_x", EMAIL_AGE);
        provisioner.ensureTable(LogTarget.tenant(TenantKey.of("o", "u")), tenantJdbc, "tool_x", EMAIL_AGE);

        assertThat(jdbc.hasTable("tool_x")).isTrue();
        assertThat(tenantJdbc.hasTable("tool_x")).isTrue();
    }

    @Test
    void existingTableIsNotRecreated() {
        jdbc.givenTable("tool_send_email", Map.of("id", "bigint", "email", "text"));

        LogTableSchema schema = provisioner.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE);

        assertThat(jdbc.ddl).isEmpty();
        assertThat(schema.hasColumn("email")).isTrue();
        assertThat(schema.hasColumn("age")).isFalse();
    }

    @Test
    void addsMissingColumnsWhenEnabled() {
        LogTableProvisioner evolving = new LogTableProvisioner(new ToolLogProperties(
                new ToolLogProperties.DataSource(4, 30),
                new ToolLogProperties.Schema(true),
                new ToolLogProperties.Result(1024),
                new ToolLogProperties.Execution(1, 5)));
        jdbc.givenTable("tool_send_email", Map.of("id", "bigint", "execution_result", "jsonb", "email", "text"));

        LogTableSchema schema = evolving.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE);

        assertThat(jdbc.ddl).containsExactly(
                "ALTER TABLE \"tool_send_email\" ADD COLUMN IF NOT EXISTS \"age\" INTEGER");
        assertThat(schema.typeOf("age")).isEqualTo("integer");
    }

    @Test
    void invalidColumnNamesAreDropped() {
        List<ColumnSpec> columns = List.of(
                ColumnSpec.of("user-name", "string"),
                ColumnSpec.of("drop;table", "string"),
                ColumnSpec.of("ok", "boolean"),
                ColumnSpec.of("id", "string"));

        LogTableSchema schema = provisioner.ensureTable(LogTarget.system(), jdbc, "tool_t", columns);

        assertThat(schema.columns().keySet())
                .containsExactly("id", "created_at", "updated_at", "execution_result", "ok");
        assertThat(schema.typeOf("id")).isEqualTo("bigint");
    }

    @Test
    void untypedColumnIsCreatedAsText() {
        LogTableSchema schema = provisioner.ensureTable(LogTarget.system(), jdbc, "tool_note",
                List.of(ColumnSpec.of("note", null), ColumnSpec.of("n", "integer")));

        assertThat(jdbc.ddl.get(0)).endsWith("\"note\" TEXT, \"n\" INTEGER)");
        assertThat(schema.typeOf("note")).isEqualTo("text");
    }

    @Test
    void invalidTableNameIssuesNoSql() {
        assertThatThrownBy(() -> provisioner.ensureTable(LogTarget.system(), jdbc, "tool_a; DROP TABLE b", EMAIL_AGE))
                .isInstanceOf(InvalidIdentifierException.class);

        assertThat(jdbc.ddl).isEmpty();
        assertThat(jdbc.queries).isEmpty();
    }

    @Test
    void mapsJsonTypesToSqlTypes() {
        assertThat(LogTableProvisioner.sqlTypeFor("string")).isEqualTo("TEXT");
        assertThat(LogTableProvisioner.sqlTypeFor("integer")).isEqualTo("INTEGER");
        assertThat(LogTableProvisioner.sqlTypeFor("number")).isEqualTo("REAL");
        assertThat(LogTableProvisioner.sqlTypeFor("boolean")).isEqualTo("BOOLEAN");
        assertThat(LogTableProvisioner.sqlTypeFor("object")).isEqualTo("JSONB");
        assertThat(LogTableProvisioner.sqlTypeFor("array")).isEqualTo("JSONB");
        assertThat(LogTableProvisioner.sqlTypeFor("date-time")).isEqualTo("TEXT");
        assertThat(LogTableProvisioner.sqlTypeFor(null)).isEqualTo("TEXT");
    }

    @ParameterizedTest
    @ValueSource(strings = {"42P07", "23505"})
    void concurrentFirstUseCreatesOneTable(String raceState) throws Exception {
        jdbc.existsBarrier = new CyclicBarrier(2);
        jdbc.duplicateCreateState = raceState;

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Callable<LogTableSchema>> calls = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                calls.add(() -> provisioner.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE));
            }
            List<LogTableSchema> results = new ArrayList<>();
            for (Future<LogTableSchema> future : pool.invokeAll(calls, 10, TimeUnit.SECONDS)) {
                results.add(future.get());
            }

            assertThat(jdbc.createStatements()).isEqualTo(2);
            assertThat(jdbc.hasTable("tool_send_email")).isTrue();
            assertThat(results).allSatisfy(schema -> assertThat(schema.hasColumn("age")).isTrue());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void otherDdlErrorsPropagate() {
        jdbc.ddlFailureState = "42501";

        assertThatThrownBy(() -> provisioner.ensureTable(LogTarget.system(), jdbc, "tool_send_email", EMAIL_AGE))
                .isInstanceOf(BadSqlGrammarException.class);
    }
}
