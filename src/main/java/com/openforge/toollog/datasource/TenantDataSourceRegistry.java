package com.openforge.toollog.datasource;

import com.openforge.toollog.config.ToolLogProperties;
import com.openforge.toollog.provisioning.ProvisionedResource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One small Hikari pool per tenant database, created on first use and kept
 * for the life of the process. Pools are closed on context shutdown.
 */
@Slf4j
@Component
public class TenantDataSourceRegistry implements DisposableBean {

    private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();
    private final ToolLogProperties.DataSource  settings;

    public TenantDataSourceRegistry(ToolLogProperties properties) {
        this.settings = properties.datasource();
    }

    public DataSource dataSourceFor(ProvisionedResource resource) {
        return pools.computeIfAbsent(resource.resourceName(),
                name -> createPool(name, resource.connectionString()));
    }

    /** A JdbcTemplate over the tenant pool with the configured statement timeout applied. */
    public JdbcTemplate jdbcTemplateFor(ProvisionedResource resource) {
        JdbcTemplate template = new JdbcTemplate(dataSourceFor(resource));
        template.setQueryTimeout(settings.queryTimeoutSeconds());
        return template;
    }

    public int poolCount() {
        return pools.size();
    }

    @Override
    public void destroy() {
        pools.forEach((name, pool) -> {
            log.info("[TenantDS] Closing pool for '{}'.", name);
            pool.close();
        });
        pools.clear();
    }

    private HikariDataSource createPool(String resourceName, String connectionString) {
        ConnectionStrings.JdbcCoordinates jdbc = ConnectionStrings.toJdbc(connectionString);

        HikariConfig config = new HikariConfig();
        config.setPoolName("tenant-" + resourceName);
        config.setJdbcUrl(jdbc.jdbcUrl());
        config.setUsername(jdbc.username());
        config.setPassword(jdbc.password());
        config.setMaximumPoolSize(settings.maximumPoolSize());
        config.setMinimumIdle(0);
        // no idle floor: tenant databases may scale to zero
        config.setIdleTimeout(60_000);
        // lazy: connect on first borrow
        config.setInitializationFailTimeout(-1);

        log.info("[TenantDS] Creating pool for '{}' → {}", resourceName, jdbc.jdbcUrl());
        return new HikariDataSource(config);
    }
}
