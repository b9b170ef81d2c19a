package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import net.vortexdevelopment.vcache.monitor.MetricType;

import java.time.Duration;
import java.util.Map;

/**
 * Per metric type statistics over a window of samples.
 */
@Value
@Builder
public class DetailedMetrics {
    String layer;
    Duration window;
    Map<MetricType, MetricSummary> metrics;
}
