package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import net.vortexdevelopment.vcache.monitor.CacheAlert;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Combined analysis of the memory layer with active alerts and recommendations.
 * Detailed reports also carry historical metrics and the monitor status.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceReport {
    Instant timestamp;
    HitRateReport hitRate;
    SizeReport size;
    EvictionReport evictions;
    List<CacheAlert> alerts;
    List<String> recommendations;
    @Nullable
    DetailedMetrics detailedMetrics;
    @Nullable
    MonitoringStatus monitoringStatus;
}
