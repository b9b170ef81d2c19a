package net.vortexdevelopment.vcache.monitor;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds used by the {@link PerformanceAnalyzer} to raise alerts.
 */
@Value
@Builder
public class AlertThresholds {

    /** Alert when the hit rate drops below this ratio. */
    @Builder.Default
    double hitRateLow = 0.7;
    /** Alert when the memory layer is fuller than this ratio. */
    @Builder.Default
    double utilizationHigh = 0.9;
    /** Evictions per minute. */
    @Builder.Default
    double evictionRateHigh = 100;
    /** Relative hit rate drop against the rolling average. */
    @Builder.Default
    double degradationThreshold = 0.15;
    /** Low hit rate alerts need at least this many requests. */
    @Builder.Default
    long minRequestsForHitRateAlert = 100;

    public static AlertThresholds defaults() {
        return AlertThresholds.builder().build();
    }
}
