package net.vortexdevelopment.vcache.monitor;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Single metric sample.
 */
@Value
public class CacheMetric {
    Instant timestamp;
    String layer;
    MetricType type;
    double value;
    Map<String, Object> metadata;
}
