package net.vortexdevelopment.vcache.warming.report;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

@Value
@Builder
public class TaskDetails {
    String taskId;
    String name;
    boolean enabled;
    int priority;
    boolean critical;
    long runCount;
    double avgDurationMs;
    @Nullable
    Instant lastRun;
    @Nullable
    Instant nextRun;
}
