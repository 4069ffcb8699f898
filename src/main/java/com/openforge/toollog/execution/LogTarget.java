package com.openforge.toollog.execution;

import com.openforge.toollog.tenant.TenantKey;
import com.openforge.toollog.tenant.TenantResourceNamer;

/**
 * Where an execution record is written: the fixed system database, or the
 * isolated database of one tenant.
 */
public record LogTarget(
        Scope scope,
        TenantKey tenant
) {

    public enum Scope { SYSTEM, TENANT }

    private static final LogTarget SYSTEM = new LogTarget(Scope.SYSTEM, null);

    public LogTarget {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        if (scope == Scope.TENANT && tenant == null) {
            throw new IllegalArgumentException("tenant-scoped log target requires a tenant key");
        }
    }

    public static LogTarget system() {
        return SYSTEM;
    }

    public static LogTarget tenant(TenantKey tenant) {
        return new LogTarget(Scope.TENANT, tenant);
    }

    /** Stable key for per-database caches: "system" or the tenant's resource name. */
    public String cacheKey() {
        return scope == Scope.SYSTEM ? "system" : TenantResourceNamer.nameFor(tenant);
    }
}
