package net.vortexdevelopment.vcache.warming.report;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WarmingPerformance {
    long totalWarmings;
    double totalDurationMs;
    double avgDurationMs;
    double fastestMs;
    double slowestMs;
    /** 100 for instant warmings, falling to 0 at an average of one second. */
    double efficiencyScore;
}
