package net.vortexdevelopment.vcache.cache;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * Wrapper for cached values with metadata.
 * Tracks access patterns and expiry for LRU eviction and tag invalidation.
 * Mutated only under the owning {@link CacheStore}'s lock.
 */
@Getter
public class CacheEntry {
    private final String key;
    private final Object value;
    private final Instant createdAt;
    @Nullable
    private final Instant expiresAt;
    private final Set<String> tags;
    private final long sizeBytes;
    private long hitCount;
    private Instant lastAccessed;
    private boolean stale;

    public CacheEntry(String key, Object value, Instant createdAt, @Nullable Instant expiresAt,
                      Set<String> tags, long sizeBytes) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.tags = Collections.unmodifiableSet(tags);
        this.sizeBytes = sizeBytes;
        this.hitCount = 0;
        this.lastAccessed = createdAt;
    }

    /**
     * Check if this entry is expired at the given instant.
     * Entries without an expiry never expire.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Mark this entry as accessed, updating timestamp and incrementing counter.
     */
    public void touch(Instant now) {
        this.hitCount++;
        this.lastAccessed = now;
    }

    /**
     * Mark this entry as stale; it is dropped on its next read.
     */
    public void markStale() {
        this.stale = true;
    }

    /**
     * @return true if this entry carries at least one of the given tags
     */
    public boolean hasAnyTag(Set<String> candidates) {
        if (tags.isEmpty() || candidates.isEmpty()) {
            return false;
        }
        for (String tag : candidates) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
