package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class MonitoringStatus {
    boolean running;
    Duration collectionInterval;
    long collectionCount;
    boolean autoCleanupEnabled;
    double cleanupThreshold;
    @Nullable
    Instant lastAlertCheck;
}
