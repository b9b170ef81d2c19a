package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import net.vortexdevelopment.vcache.monitor.HealthStatus;

@Value
@Builder
public class SizeReport {
    String layer;
    int entries;
    int maxEntries;
    double utilization;
    long totalSizeBytes;
    HealthStatus status;

    public double getTotalSizeMb() {
        return totalSizeBytes / (1024.0 * 1024.0);
    }
}
