package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import net.vortexdevelopment.vcache.monitor.HealthStatus;

@Value
@Builder
public class EvictionReport {
    String layer;
    long evictions;
    long expirations;
    /** Evictions per minute since the previous analysis; 0 on the first one. */
    double evictionRatePerMinute;
    HealthStatus status;
}
