package net.vortexdevelopment.vcache.cache;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Set;

/**
 * Backend used for memory-only deployments.
 */
public class NoOpPersistentBackend implements PersistentBackend {

    @Override
    @Nullable
    public Object get(String key) {
        return null;
    }

    @Override
    public void set(String key, Object value, @Nullable Duration ttl, Set<String> tags) {
    }

    @Override
    public boolean delete(String key) {
        return false;
    }

    @Override
    public void clear() {
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
