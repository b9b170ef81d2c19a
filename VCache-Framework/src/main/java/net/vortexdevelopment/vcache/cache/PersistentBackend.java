package net.vortexdevelopment.vcache.cache;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Set;

/**
 * Durable key/value store behind the memory layer.
 * <p>
 * Implementations may throw unchecked exceptions on I/O failures;
 * {@link MultiLayerCache} catches them and degrades to a miss or no-op.
 */
public interface PersistentBackend {

    /**
     * @return the stored value, or null if absent or expired
     */
    @Nullable
    Object get(String key);

    /**
     * Store a value. A null TTL applies the backend's default TTL; a zero or negative TTL
     * stores the value without expiry.
     */
    void set(String key, Object value, @Nullable Duration ttl, Set<String> tags);

    /**
     * @return true if the key was present
     */
    boolean delete(String key);

    void clear();

    /**
     * Remove entries carrying any of the given tags.
     * Backends without tag support keep the default and report nothing removed.
     *
     * @return number of entries removed
     */
    default int invalidateByTags(Set<String> tags) {
        return 0;
    }

    /**
     * @return false for backends that never store anything
     */
    default boolean isEnabled() {
        return true;
    }
}
