package com.openforge.toollog.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables for tenant data sources, log-table schema handling, result
 * normalization and the asynchronous logging executor.
 *
 * application.yml:
 *
 * toollog:
 *   datasource:
 *     maximum-pool-size: 4
 *     query-timeout-seconds: 30
 *   schema:
 *     add-missing-columns: false
 *   result:
 *     max-unzipped-bytes: 52428800
 *   execution:
 *     pool-size: 4
 *     timeout-seconds: 60
 */
@Validated
@ConfigurationProperties(prefix = "toollog")
public record ToolLogProperties(
        @DefaultValue DataSource datasource,
        @DefaultValue Schema     schema,
        @DefaultValue Result     result,
        @DefaultValue Execution  execution
) {

    public record DataSource(
            @DefaultValue("4")  @Positive int maximumPoolSize,
            @DefaultValue("30") @Positive int queryTimeoutSeconds
    ) {}

    /** When true, declared columns missing from an existing log table are added (never dropped). */
    public record Schema(
            @DefaultValue("false") boolean addMissingColumns
    ) {}

    public record Result(
            @DefaultValue("52428800") @Positive long maxUnzippedBytes
    ) {}

    public record Execution(
            @DefaultValue("4")  @Positive int poolSize,
            @DefaultValue("60") @Positive int timeoutSeconds
    ) {}

    /** Defaults used outside a Spring context (tests, ad-hoc wiring). */
    public static ToolLogProperties defaults() {
        return new ToolLogProperties(
                new DataSource(4, 30),
                new Schema(false),
                new Result(52_428_800L),
                new Execution(4, 60));
    }
}
