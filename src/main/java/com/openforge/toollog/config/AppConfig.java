package com.openforge.toollog.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - toolLogExecutor  → bounded pool for fire-and-report execution logging
 *  - Java HttpClient  → the only HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * Runs ExecutionLogger.logAsync work off the caller's thread.
     * Fixed size; work queues while every thread is busy.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolLogExecutor(ToolLogProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "tool-log-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.execution().poolSize(), factory);
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for the control-plane JSON:
     *  - snake_case property names (connection_uri, region_id …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
