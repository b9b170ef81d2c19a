package net.vortexdevelopment.vcache.monitor.report;

import lombok.Builder;
import lombok.Value;
import net.vortexdevelopment.vcache.monitor.Trend;
import org.jetbrains.annotations.Nullable;

@Value
@Builder
public class MetricSummary {
    double current;
    double average;
    double min;
    double max;
    int count;
    @Nullable
    Trend trend;
}
