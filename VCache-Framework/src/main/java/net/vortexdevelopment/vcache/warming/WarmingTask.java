package net.vortexdevelopment.vcache.warming;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import net.vortexdevelopment.vcache.cache.ComputeFunction;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A cache key with the function producing its value, warmed by the {@link WarmingEngine}.
 * Run statistics and the schedule are updated by the engine under its lock.
 */
@Getter
public class WarmingTask {

    private final String taskId;
    private final String name;
    private final String cacheKey;
    private final ComputeFunction<?> computeFn;
    @Nullable
    private final Duration ttl;
    private final Set<String> tags;
    private final int priority;
    /** Free-form schedule description, e.g. a cron expression. Informational. */
    @Nullable
    private final String schedule;

    private boolean enabled;
    @Nullable
    private Instant lastRun;
    @Nullable
    private Instant nextRun;
    private long runCount;
    private double avgDurationMs;
    @Nullable
    private Duration interval;

    @Builder
    private WarmingTask(String taskId, @Nullable String name, String cacheKey, ComputeFunction<?> computeFn,
                        @Nullable Duration ttl, @Singular Set<String> tags, int priority, @Nullable String schedule,
                        @Nullable Boolean enabled, @Nullable Instant nextRun) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        this.taskId = taskId;
        this.name = name == null ? taskId : name;
        this.cacheKey = Objects.requireNonNull(cacheKey, "cacheKey");
        this.computeFn = Objects.requireNonNull(computeFn, "computeFn");
        this.ttl = ttl;
        this.tags = Set.copyOf(tags);
        this.priority = priority;
        this.schedule = schedule;
        this.enabled = enabled == null || enabled;
        this.nextRun = nextRun;
    }

    public boolean shouldRun(Instant now) {
        if (!enabled) {
            return false;
        }
        return nextRun == null || !now.isBefore(nextRun);
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void recordRun(double durationMs, Instant now) {
        lastRun = now;
        runCount++;
        avgDurationMs = (avgDurationMs * (runCount - 1) + durationMs) / runCount;
    }

    void reschedule(Instant now, Duration interval) {
        this.interval = interval;
        this.nextRun = now.plus(interval);
    }
}
