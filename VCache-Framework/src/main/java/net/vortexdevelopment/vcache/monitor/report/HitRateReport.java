package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import net.vortexdevelopment.vcache.monitor.HealthStatus;
import net.vortexdevelopment.vcache.monitor.Trend;
import org.jetbrains.annotations.Nullable;

@Value
@Builder
public class HitRateReport {
    String layer;
    double hitRate;
    long hits;
    long misses;
    long totalRequests;
    @Nullable
    Trend trend;
    HealthStatus status;
}
