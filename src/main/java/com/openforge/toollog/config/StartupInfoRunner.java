package com.openforge.toollog.config;

import com.openforge.toollog.provisioning.ControlPlaneProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - System database: attempts to open a real JDBC connection and reads the server version
 *   - Control plane: base URL, default database/role and (masked) api key
 *   - Logging settings: schema evolution flag, executor size, timeouts
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource             dataSource;
    private final ControlPlaneProperties controlPlane;
    private final ToolLogProperties      properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              toollog  -  Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  System database                                         ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Control plane                                           ║
                ║    Base URL       : {}
                ║    Database/Role  : {} / {}
                ║    API key        : {}
                ║    Timeout        : {}s
                ╠══════════════════════════════════════════════════════════╣
                ║  Execution logging                                       ║
                ║    Add columns    : {}
                ║    Executor size  : {}   timeout={}s
                ║    Query timeout  : {}s  tenant pool size={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                checkDatabase(),

                controlPlane.baseUrl(),
                controlPlane.databaseName(), controlPlane.roleName(),
                maskKey(controlPlane.apiKey()),
                controlPlane.timeoutSeconds(),

                properties.schema().addMissingColumns(),
                properties.execution().poolSize(), properties.execution().timeoutSeconds(),
                properties.datasource().queryTimeoutSeconds(), properties.datasource().maximumPoolSize()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** Shows the first 6 and last 4 characters of a key; "(not set)" for blanks. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "****";
        return key.substring(0, 6) + "****" + key.substring(key.length() - 4);
    }
}
