package net.vortexdevelopment.vcache.monitor;

/**
 * Kind of a recorded metric. The direction decides how a trend is classified.
 */
public enum MetricType {
    HIT_RATE("hit_rate", true),
    MISS_RATE("miss_rate", false),
    UTILIZATION("utilization", false),
    EVICTIONS("evictions", false),
    EVICTION_RATE("eviction_rate", false),
    PERFORMANCE_DEGRADATION("performance_degradation", false);

    private final String id;
    private final boolean higherBetter;

    MetricType(String id, boolean higherBetter) {
        this.id = id;
        this.higherBetter = higherBetter;
    }

    public String id() {
        return id;
    }

    public boolean isHigherBetter() {
        return higherBetter;
    }
}
