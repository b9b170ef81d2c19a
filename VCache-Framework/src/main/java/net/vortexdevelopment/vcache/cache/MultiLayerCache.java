package net.vortexdevelopment.vcache.cache;

import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.debug.DebugLogger;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Multi-layer cache coordinator (memory + persistent backend).
 * <p>
 * Reads try the memory layer first and fall back to the backend, writing backend hits
 * through into memory. Backend failures are logged and treated as a miss or no-op, so
 * the memory layer stays usable while the backend is down.
 * <p>
 * {@link #getOrCompute} deduplicates concurrent computations per key: callers that miss
 * while another thread computes the same key wait for that result instead of invoking
 * their own compute function.
 */
@Slf4j
public class MultiLayerCache {

    private static final Set<CacheLayer> ALL_LAYERS = EnumSet.allOf(CacheLayer.class);

    private final CacheStore memory;
    private final PersistentBackend backend;
    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final List<Consumer<String>> accessListeners = new CopyOnWriteArrayList<>();

    public MultiLayerCache(CacheStore memory, PersistentBackend backend) {
        this.memory = Objects.requireNonNull(memory, "memory");
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    /**
     * Get value from cache (checks all layers).
     *
     * @return the value, or null on a miss in every layer
     */
    @Nullable
    public Object get(String key) {
        notifyAccess(key);

        Object value = memory.get(key);
        if (value != null) {
            return value;
        }

        value = backendGet(key);
        if (value != null) {
            memory.set(key, value, null, null);
            DebugLogger.log("Backend HIT for key: %s, written through to memory", key);
            return value;
        }
        return null;
    }

    /**
     * Set value in all layers.
     */
    public void set(String key, Object value, @Nullable Duration ttl, @Nullable Set<String> tags) {
        set(key, value, ttl, tags, ALL_LAYERS);
    }

    /**
     * Set value in the selected layers.
     */
    public void set(String key, Object value, @Nullable Duration ttl, @Nullable Set<String> tags,
                    Set<CacheLayer> layers) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Set<String> safeTags = tags == null ? Set.of() : tags;

        if (layers.contains(CacheLayer.MEMORY)) {
            memory.set(key, value, ttl, safeTags);
        }
        if (layers.contains(CacheLayer.PERSISTENT)) {
            backendSet(key, value, ttl, safeTags);
        }
    }

    /**
     * Get a value from the cache or compute and cache it.
     *
     * @param key cache key
     * @param fn function computing the value on a miss
     * @param ttl time to live, null for the default
     * @param tags tags for invalidation
     * @param forceRefresh bypass the cache and recompute
     * @return cached or computed value
     * @throws CacheException if the computation fails or returns null
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, ComputeFunction<T> fn, @Nullable Duration ttl,
                              @Nullable Set<String> tags, boolean forceRefresh) {
        if (!forceRefresh) {
            Object cached = get(key);
            if (cached != null) {
                return (T) cached;
            }
        }

        CompletableFuture<Object> flight = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            DebugLogger.log("Joining in-flight computation for key: %s", key);
            return (T) awaitInFlight(key, existing);
        }

        try {
            if (!forceRefresh) {
                // Another caller may have finished between our miss and claiming the flight
                Object cached = memory.peek(key);
                if (cached != null) {
                    flight.complete(cached);
                    return (T) cached;
                }
            }

            long start = System.nanoTime();
            T value = fn.compute();
            if (value == null) {
                throw new CacheException("Compute function returned null for key " + key);
            }
            long computeMs = (System.nanoTime() - start) / 1_000_000;

            set(key, value, ttl, tags);
            flight.complete(value);
            log.debug("Value computed and cached key={} computeTimeMs={}", key, computeMs);
            return value;
        } catch (CacheException e) {
            flight.completeExceptionally(e);
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            CacheException wrapped = new CacheException("Failed to compute value for key " + key, e);
            flight.completeExceptionally(wrapped);
            throw wrapped;
        } catch (Error e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, flight);
        }
    }

    /**
     * Equivalent to {@code getOrCompute(key, fn, ttl, tags, false)}.
     */
    public <T> T getOrCompute(String key, ComputeFunction<T> fn, @Nullable Duration ttl,
                              @Nullable Set<String> tags) {
        return getOrCompute(key, fn, ttl, tags, false);
    }

    private Object awaitInFlight(String key, CompletableFuture<Object> flight) {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException("Interrupted while waiting for value of key " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CacheException(cause.getMessage(), cause);
        }
    }

    /**
     * Delete key from all cache layers.
     *
     * @return true if any layer held the key
     */
    public boolean delete(String key) {
        boolean memoryDeleted = memory.delete(key);
        boolean backendDeleted = backendDelete(key);
        return memoryDeleted || backendDeleted;
    }

    /**
     * Clear all cache layers.
     */
    public void clear() {
        memory.clear();
        try {
            backend.clear();
            log.info("Cache cleared layer={}", CacheLayer.PERSISTENT.id());
        } catch (RuntimeException e) {
            log.warn("Backend cache clear failed error={}", e.getMessage(), e);
        }
    }

    /**
     * Invalidate cache entries by tags across all layers.
     *
     * @return number of entries removed, summed over layers
     */
    public int invalidateByTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return 0;
        }
        int count = memory.invalidateByTags(tags);
        try {
            count += backend.invalidateByTags(tags);
        } catch (RuntimeException e) {
            log.warn("Backend cache invalidation failed tags={} error={}", tags, e.getMessage(), e);
        }
        return count;
    }

    /**
     * Invalidate by tags and explicit keys in one call.
     *
     * @return number of entries invalidated
     */
    public int invalidate(@Nullable Set<String> tags, @Nullable Collection<String> keys) {
        int count = 0;
        if (tags != null && !tags.isEmpty()) {
            count += invalidateByTags(tags);
        }
        if (keys != null) {
            for (String key : keys) {
                if (delete(key)) {
                    count++;
                }
            }
        }
        log.info("Cache invalidated tags={} keys={} count={}", tags == null ? Set.of() : tags,
                keys == null ? 0 : keys.size(), count);
        return count;
    }

    /**
     * Mark memory entries stale by tags. The backend has no stale state, so matching backend
     * entries are removed right away to keep a later read-through from resurrecting them.
     *
     * @return number of memory entries marked stale
     */
    public int markStaleByTags(Set<String> tags) {
        int count = memory.markStaleByTags(tags);
        try {
            backend.invalidateByTags(tags);
        } catch (RuntimeException e) {
            log.warn("Backend cache invalidation failed tags={} error={}", tags, e.getMessage(), e);
        }
        return count;
    }

    /**
     * Register a listener notified with the key of every read.
     */
    public void addAccessListener(Consumer<String> listener) {
        accessListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public CacheStats getStats() {
        return memory.getStats();
    }

    public CacheStore getMemoryStore() {
        return memory;
    }

    public boolean isPersistentEnabled() {
        return backend.isEnabled();
    }

    private void notifyAccess(String key) {
        for (Consumer<String> listener : accessListeners) {
            try {
                listener.accept(key);
            } catch (RuntimeException e) {
                log.warn("Cache access listener failed key={} error={}", key, e.getMessage(), e);
            }
        }
    }

    @Nullable
    private Object backendGet(String key) {
        if (!backend.isEnabled()) {
            return null;
        }
        try {
            return backend.get(key);
        } catch (RuntimeException e) {
            log.warn("Backend cache get failed key={} error={}", key, e.getMessage(), e);
            return null;
        }
    }

    private void backendSet(String key, Object value, @Nullable Duration ttl, Set<String> tags) {
        if (!backend.isEnabled()) {
            return;
        }
        try {
            backend.set(key, value, ttl, tags);
        } catch (RuntimeException e) {
            log.warn("Backend cache set failed key={} error={}", key, e.getMessage(), e);
        }
    }

    private boolean backendDelete(String key) {
        if (!backend.isEnabled()) {
            return false;
        }
        try {
            return backend.delete(key);
        } catch (RuntimeException e) {
            log.warn("Backend cache delete failed key={} error={}", key, e.getMessage(), e);
            return false;
        }
    }
}
