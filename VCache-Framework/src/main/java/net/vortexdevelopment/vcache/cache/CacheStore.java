package net.vortexdevelopment.vcache.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.debug.DebugLogger;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory cache with LRU eviction and TTL support.
 * <p>
 * Entries are kept in insertion order and moved to the tail on every hit or rewrite,
 * so the head of the map is always the least recently used entry. Expired entries are
 * dropped lazily on read (counted as expirations) or in bulk by {@link #purgeExpired()}.
 * A single re-entrant lock guards all reads and mutations.
 */
@Slf4j
public class CacheStore {

    public static final String LAYER = CacheLayer.MEMORY.id();

    private static final ObjectMapper SIZE_MAPPER = new ObjectMapper();

    private final int maxEntries;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Map<String, CacheEntry> storage = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public CacheStore(int maxEntries, Duration defaultTtl) {
        this(maxEntries, defaultTtl, Clock.systemUTC());
    }

    public CacheStore(int maxEntries, Duration defaultTtl, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
        DebugLogger.log("Created memory cache with maxEntries=%d, defaultTtl=%s", maxEntries, defaultTtl);
    }

    /**
     * Get a value from the cache.
     *
     * @param key the key
     * @return the value, or null on a miss (absent, expired or stale)
     */
    @Nullable
    public Object get(String key) {
        lock.lock();
        try {
            CacheEntry entry = storage.get(key);
            if (entry == null) {
                misses++;
                DebugLogger.log("Cache MISS for key: %s", key);
                return null;
            }

            Instant now = clock.instant();
            if (entry.isExpired(now)) {
                storage.remove(key);
                expirations++;
                misses++;
                DebugLogger.log("Entry expired for key: %s", key);
                return null;
            }

            if (entry.isStale()) {
                storage.remove(key);
                misses++;
                DebugLogger.log("Dropping stale entry for key: %s", key);
                return null;
            }

            // Move to tail (most recently used)
            storage.remove(key);
            storage.put(key, entry);
            entry.touch(now);
            hits++;
            DebugLogger.log("Cache HIT for key: %s (hit count: %d)", key, entry.getHitCount());
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a value into the cache, evicting least recently used entries when over capacity.
     *
     * @param key the key
     * @param value the value, must not be null
     * @param ttl time to live; null uses the default TTL, zero or negative disables expiry
     * @param tags tags for group invalidation, may be null
     */
    public void set(String key, Object value, @Nullable Duration ttl, @Nullable Set<String> tags) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        long sizeBytes = estimateSize(value);

        lock.lock();
        try {
            Instant now = clock.instant();
            Instant expiresAt = effectiveTtl.isZero() || effectiveTtl.isNegative() ? null : now.plus(effectiveTtl);
            CacheEntry entry = new CacheEntry(key, value, now, expiresAt,
                    tags == null ? Set.of() : new HashSet<>(tags), sizeBytes);

            storage.remove(key);
            storage.put(key, entry);

            Iterator<Map.Entry<String, CacheEntry>> iterator = storage.entrySet().iterator();
            while (storage.size() > maxEntries && iterator.hasNext()) {
                String evictedKey = iterator.next().getKey();
                iterator.remove();
                evictions++;
                DebugLogger.log("Evicting entry for key: %s (LRU)", evictedKey);
            }

            DebugLogger.log("Caching entry for key: %s with ttl=%s (size: %d/%d)",
                    key, effectiveTtl, storage.size(), maxEntries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a value from the cache.
     *
     * @return true if an entry was removed
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            boolean removed = storage.remove(key) != null;
            if (removed) {
                DebugLogger.log("Removing entry for key: %s", key);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry.
     */
    public void clear() {
        lock.lock();
        try {
            int size = storage.size();
            storage.clear();
            log.info("Cache cleared layer={} entries={}", LAYER, size);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every live entry whose tag set intersects the given tags.
     *
     * @return number of entries removed
     */
    public int invalidateByTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            int count = 0;
            Iterator<CacheEntry> iterator = storage.values().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next();
                if (!entry.isExpired(now) && entry.hasAnyTag(tags)) {
                    iterator.remove();
                    count++;
                }
            }
            log.info("Cache invalidated by tags layer={} tags={} count={}", LAYER, tags, count);
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark every live entry whose tags intersect the given tags as stale.
     * Stale entries stay in place until read, then miss.
     *
     * @return number of entries marked
     */
    public int markStaleByTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            int count = 0;
            for (CacheEntry entry : storage.values()) {
                if (!entry.isStale() && !entry.isExpired(now) && entry.hasAnyTag(tags)) {
                    entry.markStale();
                    count++;
                }
            }
            DebugLogger.log("Marked %d entries stale for tags %s", count, tags);
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clean up expired entries. Called by the monitor's default cleanup callback.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> expiredKeys = new ArrayList<>();
            for (CacheEntry entry : storage.values()) {
                if (entry.isExpired(now)) {
                    expiredKeys.add(entry.getKey());
                }
            }
            for (String key : expiredKeys) {
                storage.remove(key);
                expirations++;
            }
            if (!expiredKeys.isEmpty()) {
                DebugLogger.log("Cleaning up %d expired entries", expiredKeys.size());
            }
            return expiredKeys.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return snapshot of all keys, least recently used first
     */
    public List<String> getAllKeys() {
        lock.lock();
        try {
            return new ArrayList<>(storage.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read a live value without touching it or updating counters.
     */
    @Nullable
    public Object peek(String key) {
        lock.lock();
        try {
            CacheEntry entry = storage.get(key);
            if (entry == null || entry.isStale() || entry.isExpired(clock.instant())) {
                return null;
            }
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Peek at an entry without touching it or updating counters.
     */
    @Nullable
    public CacheEntry getEntry(String key) {
        lock.lock();
        try {
            return storage.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return keys of live entries carrying any of the given tags
     */
    public List<String> getKeysWithAnyTag(Set<String> tags) {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> keys = new ArrayList<>();
            for (CacheEntry entry : storage.values()) {
                if (!entry.isExpired(now) && entry.hasAnyTag(tags)) {
                    keys.add(entry.getKey());
                }
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            long totalSize = 0;
            for (CacheEntry entry : storage.values()) {
                totalSize += entry.getSizeBytes();
            }
            return CacheStats.builder()
                    .layer(LAYER)
                    .entries(storage.size())
                    .maxEntries(maxEntries)
                    .hits(hits)
                    .misses(misses)
                    .hitRate(CacheStats.calculateHitRate(hits, misses))
                    .evictions(evictions)
                    .expirations(expirations)
                    .totalSizeBytes(totalSize)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return storage.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * Best-effort serialized size of a value; 0 if it cannot be serialized.
     */
    static long estimateSize(Object value) {
        try {
            return SIZE_MAPPER.writeValueAsBytes(value).length;
        } catch (JsonProcessingException | RuntimeException e) {
            DebugLogger.log(CacheStore.class, "Size estimation failed for %s: %s",
                    value.getClass().getName(), e.getMessage());
            return 0;
        }
    }
}
