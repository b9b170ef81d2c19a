package net.vortexdevelopment.vcache.warming.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WarmingReport {
    int total;
    int succeeded;
    int failed;
    int skipped;
    List<TaskOutcome> outcomes;
    long durationMs;
}
