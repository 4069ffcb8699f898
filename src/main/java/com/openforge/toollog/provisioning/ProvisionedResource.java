package com.openforge.toollog.provisioning;

/**
 * A tenant database ready for use. Never mutated once built: connection
 * strings are treated as immutable for the life of the process.
 */
public record ProvisionedResource(
        String resourceId,
        String resourceName,
        String connectionString
) {

    /** The connection string with its password replaced, safe for log output. */
    public String maskedConnectionString() {
        return connectionString == null ? null
                : connectionString.replaceAll("://([^:/@]+):[^@]*@", "://$1:***@");
    }

    @Override
    public String toString() {
        return "ProvisionedResource[resourceId=%s, resourceName=%s, connectionString=%s]"
                .formatted(resourceId, resourceName, maskedConnectionString());
    }
}
