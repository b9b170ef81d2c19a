package net.vortexdevelopment.vcache.cache;

import lombok.Builder;
import lombok.Getter;

/**
 * Point-in-time statistics of a cache layer.
 */
@Getter
@Builder
public class CacheStats {
    private final String layer;
    private final int entries;
    private final int maxEntries;
    private final long hits;
    private final long misses;
    private final double hitRate;
    private final long evictions;
    private final long expirations;
    private final long totalSizeBytes;

    /**
     * Calculate hit rate from hits and misses.
     */
    public static double calculateHitRate(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    /**
     * @return entries / maxEntries, or 0 when the layer is unbounded
     */
    public double getUtilization() {
        return maxEntries > 0 ? (double) entries / maxEntries : 0.0;
    }

    public long getTotalRequests() {
        return hits + misses;
    }
}
