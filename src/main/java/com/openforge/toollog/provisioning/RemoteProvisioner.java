package com.openforge.toollog.provisioning;

import com.openforge.toollog.provisioning.model.RemoteProject;
import com.openforge.toollog.tenant.TenantKey;
import com.openforge.toollog.tenant.TenantResourceNamer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds or creates the isolated database of a tenant and fetches its
 * connection string.
 *
 * Idempotent under concurrent first use: when two processes race to create
 * the same project, the loser receives HTTP 409 from the control plane and
 * resolves the winner's project by listing again. No retries happen here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteProvisioner {

    private final ControlPlaneClient controlPlane;
    private final ProvisioningCache  cache;

    /** Resolves the tenant's database end to end, read-through the cache. */
    public ProvisionedResource provision(TenantKey tenant) {
        String resourceName = TenantResourceNamer.nameFor(tenant);
        return cache.resource(resourceName, () -> {
            RemoteProject project = findOrCreate(resourceName);
            String connectionString = getConnectionString(project.id());
            log.info("[Provisioner] Tenant database '{}' ready (project id={}).", resourceName, project.id());
            return new ProvisionedResource(project.id(), resourceName, connectionString);
        });
    }

    public RemoteProject findOrCreate(String resourceName) {
        return cache.project(resourceName, () -> {
            Optional<RemoteProject> existing = findByName(resourceName);
            if (existing.isPresent()) {
                log.debug("[Provisioner] Found existing project '{}'.", resourceName);
                return existing.get();
            }

            log.info("[Provisioner] No project named '{}'. Creating one...", resourceName);
            Optional<RemoteProject> created = controlPlane.createProject(resourceName);
            if (created.isPresent()) {
                log.info("[Provisioner] Created project '{}' with id '{}'.",
                        resourceName, created.get().id());
                return created.get();
            }

            // Lost a creation race: the project exists now, so it must be listable.
            return findByName(resourceName).orElseThrow(() -> new ProvisioningException(
                    "Project '%s' reported as existing but not found in project list".formatted(resourceName),
                    409, null));
        });
    }

    public String getConnectionString(String resourceId) {
        return cache.connectionString(resourceId, () -> controlPlane.getConnectionUri(resourceId));
    }

    private Optional<RemoteProject> findByName(String resourceName) {
        return controlPlane.listProjects().stream()
                .filter(p -> resourceName.equals(p.name()))
                .findFirst();
    }
}
