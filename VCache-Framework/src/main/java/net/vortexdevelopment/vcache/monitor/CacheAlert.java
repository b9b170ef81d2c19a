package net.vortexdevelopment.vcache.monitor;

import lombok.Getter;

import java.time.Instant;

/**
 * Performance alert raised by the {@link PerformanceAnalyzer}.
 * Everything except the acknowledged flag is fixed at creation.
 */
@Getter
public class CacheAlert {

    private final String id;
    private final AlertSeverity severity;
    private final String message;
    private final MetricType metricType;
    private final double threshold;
    private final double actualValue;
    private final Instant timestamp;
    private volatile boolean acknowledged;

    public CacheAlert(String id, AlertSeverity severity, String message, MetricType metricType,
                      double threshold, double actualValue, Instant timestamp) {
        this.id = id;
        this.severity = severity;
        this.message = message;
        this.metricType = metricType;
        this.threshold = threshold;
        this.actualValue = actualValue;
        this.timestamp = timestamp;
    }

    public void acknowledge() {
        this.acknowledged = true;
    }

    @Override
    public String toString() {
        return "CacheAlert{" + id + ", " + severity + ", " + message + "}";
    }
}
