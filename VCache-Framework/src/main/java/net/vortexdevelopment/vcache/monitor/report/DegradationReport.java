package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class DegradationReport {
    String layer;
    double currentHitRate;
    double historicalAverage;
    double degradationPercent;
    double thresholdPercent;
    Duration window;
    Instant detectedAt;
}
