package com.openforge.toollog.provisioning;

import com.openforge.toollog.provisioning.model.RemoteProject;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-lifetime memo of control-plane lookups.
 *
 * Three append-only maps:
 *   projects           resource name → project metadata   (list/create result)
 *   connectionStrings  project id    → connection string  (connection_uri result)
 *   resources          resource name → fully provisioned resource
 *
 * Loaders run outside any lock, so two threads missing the same key may both
 * call the control plane. The first value stored wins and every caller gets
 * that value back. Entries are never evicted or replaced.
 */
@Component
public class ProvisioningCache {

    private final Map<String, RemoteProject>       projects          = new ConcurrentHashMap<>();
    private final Map<String, String>              connectionStrings = new ConcurrentHashMap<>();
    private final Map<String, ProvisionedResource> resources         = new ConcurrentHashMap<>();

    public RemoteProject project(String resourceName, Supplier<RemoteProject> loader) {
        return readThrough(projects, resourceName, loader);
    }

    public String connectionString(String resourceId, Supplier<String> loader) {
        return readThrough(connectionStrings, resourceId, loader);
    }

    public ProvisionedResource resource(String resourceName, Supplier<ProvisionedResource> loader) {
        return readThrough(resources, resourceName, loader);
    }

    Optional<ProvisionedResource> cachedResource(String resourceName) {
        return Optional.ofNullable(resources.get(resourceName));
    }

    /** Number of fully provisioned resources held. */
    public int size() {
        return resources.size();
    }

    /** Drops every entry. Intended for tests and explicit lifecycle resets only. */
    public void clear() {
        projects.clear();
        connectionStrings.clear();
        resources.clear();
    }

    private static <V> V readThrough(Map<String, V> map, String key, Supplier<V> loader) {
        V cached = map.get(key);
        if (cached != null) return cached;

        V loaded = loader.get();
        if (loaded == null) {
            throw new IllegalStateException("Loader returned null for key " + key);
        }
        V winner = map.putIfAbsent(key, loaded);
        return winner != null ? winner : loaded;
    }
}
