package com.openforge.toollog.tenant;

/**
 * Identifies a tenant: one user inside one organization. Each tenant owns an
 * isolated database, named by {@link TenantResourceNamer#nameFor(TenantKey)}.
 */
public record TenantKey(
        String organizationId,
        String userId
) {

    public TenantKey {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
    }

    public static TenantKey of(String organizationId, String userId) {
        return new TenantKey(organizationId, userId);
    }
}
