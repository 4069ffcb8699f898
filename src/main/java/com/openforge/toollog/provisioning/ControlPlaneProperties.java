package com.openforge.toollog.provisioning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the database-hosting control-plane API.
 *
 * application.yml:
 *
 * toollog:
 *   control-plane:
 *     base-url: https://console.neon.tech/api/v2
 *     api-key: ${NEON_API_KEY:}
 *     database-name: neondb
 *     role-name: neondb_owner
 *     timeout-seconds: 30
 *
 * The api key may be empty at startup. Tenant provisioning requires it and fails with
 * {@link ControlPlaneConfigurationException} before issuing any request.
 */
@ConfigurationProperties(prefix = "toollog.control-plane")
public record ControlPlaneProperties(
        @DefaultValue("https://console.neon.tech/api/v2") String baseUrl,
        String apiKey,
        @DefaultValue("neondb")       String databaseName,
        @DefaultValue("neondb_owner") String roleName,
        @DefaultValue("30")           int    timeoutSeconds
) {

    /**
     * Returns the trimmed bearer credential.
     *
     * @throws ControlPlaneConfigurationException if the key or base URL is not configured
     */
    public String requireApiKey() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ControlPlaneConfigurationException(
                    "toollog.control-plane.base-url is not set or is empty");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ControlPlaneConfigurationException(
                    "toollog.control-plane.api-key (NEON_API_KEY) is not set or is empty");
        }
        return apiKey.trim();
    }

    /** Base URL without a trailing slash. */
    public String normalizedBaseUrl() {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
