package com.openforge.toollog.execution;

import com.openforge.toollog.config.ToolLogProperties;
import com.openforge.toollog.datasource.TenantDataSourceRegistry;
import com.openforge.toollog.provisioning.ProvisionedResource;
import com.openforge.toollog.provisioning.RemoteProvisioner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Turns a {@link LogTarget} into a JdbcTemplate.
 *
 *   SYSTEM  → the application DataSource (spring.datasource.*)
 *   TENANT  → provision the tenant database, then its pooled DataSource
 */
@Slf4j
@Component
public class LogTargetResolver {

    private final JdbcTemplate              systemJdbc;
    private final RemoteProvisioner         provisioner;
    private final TenantDataSourceRegistry  tenantDataSources;

    public LogTargetResolver(DataSource dataSource,
                             RemoteProvisioner provisioner,
                             TenantDataSourceRegistry tenantDataSources,
                             ToolLogProperties properties) {
        this.systemJdbc = new JdbcTemplate(dataSource);
        this.systemJdbc.setQueryTimeout(properties.datasource().queryTimeoutSeconds());
        this.provisioner       = provisioner;
        this.tenantDataSources = tenantDataSources;
    }

    public JdbcTemplate resolve(LogTarget target) {
        return switch (target.scope()) {
            case SYSTEM -> systemJdbc;
            case TENANT -> {
                ProvisionedResource resource = provisioner.provision(target.tenant());
                log.debug("[Target] Tenant {} → {}", target.tenant(), resource.resourceName());
                yield tenantDataSources.jdbcTemplateFor(resource);
            }
        };
    }
}
