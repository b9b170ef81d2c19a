package net.vortexdevelopment.vcache.invalidation;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class RuleStats {
    String name;
    InvalidationStrategy strategy;
    int priority;
    long executionCount;
    long totalInvalidated;
    @Nullable
    Instant lastExecuted;
    Set<String> triggerTags;
    Set<String> invalidateTags;

    static RuleStats of(InvalidationRule rule) {
        return RuleStats.builder()
                .name(rule.getName())
                .strategy(rule.getStrategy())
                .priority(rule.getPriority())
                .executionCount(rule.getExecutionCount())
                .totalInvalidated(rule.getTotalInvalidated())
                .lastExecuted(rule.getLastExecuted())
                .triggerTags(rule.getTriggerTagNames())
                .invalidateTags(rule.getInvalidateTags())
                .build();
    }
}
