package net.vortexdevelopment.vcache.warming.report;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Result of warming one key within a warming run.
 */
@Value
@Builder
public class TaskOutcome {
    String key;
    @Nullable
    String taskId;
    @Nullable
    String name;
    boolean success;
    long durationMs;
    /** Retained access count; 0 outside usage pattern warming. */
    int accessCount;
    /** Accesses per minute; 0 outside usage pattern warming. */
    double frequency;
}
