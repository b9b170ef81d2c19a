package net.vortexdevelopment.vcache.invalidation;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Named rule mapping written resource tags to cache tags that must be invalidated.
 * <p>
 * Definition fields are immutable. Execution counters are updated by the
 * {@link InvalidationEngine} that owns the rule.
 */
@Getter
public class InvalidationRule {

    private final String name;
    private final Set<ResourceTag> triggerTags;
    private final Set<String> invalidateTags;
    @Nullable
    private final RuleCondition condition;
    private final InvalidationStrategy strategy;
    private final int priority;
    private final String description;
    @Nullable
    private final Pattern pattern;
    private final List<DataRelationship> relationships;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final Object statsLock = new Object();
    @Getter(AccessLevel.NONE)
    private long executionCount;
    @Getter(AccessLevel.NONE)
    private long totalInvalidated;
    @Getter(AccessLevel.NONE)
    private Instant lastExecuted;
    @Getter(AccessLevel.NONE)
    private long lastExecutionSequence;

    @Builder
    private InvalidationRule(String name, @Singular Set<ResourceTag> triggerTags, @Singular Set<String> invalidateTags,
                             @Nullable RuleCondition condition, @Nullable InvalidationStrategy strategy, int priority,
                             @Nullable String description, @Nullable Pattern pattern,
                             @Singular List<DataRelationship> relationships, @Nullable Instant createdAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name must not be blank");
        }
        this.name = name;
        this.triggerTags = Set.copyOf(triggerTags);
        this.invalidateTags = Set.copyOf(invalidateTags);
        this.condition = condition;
        this.strategy = strategy == null ? InvalidationStrategy.IMMEDIATE : strategy;
        this.priority = priority;
        this.description = description == null ? "" : description;
        this.pattern = pattern;
        this.relationships = List.copyOf(relationships);
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    /**
     * @return true if any trigger tag, rendered as a string, is in the given set
     */
    public boolean isTriggeredBy(Set<String> relatedTags) {
        for (ResourceTag trigger : triggerTags) {
            if (relatedTags.contains(trigger.toString())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluate the condition. A rule without condition always applies.
     */
    public boolean shouldExecute(WriteContext context) throws Exception {
        return condition == null || condition.matches(context);
    }

    public Set<String> getTriggerTagNames() {
        return triggerTags.stream().map(ResourceTag::toString).collect(Collectors.toSet());
    }

    void recordExecution(long invalidated, Instant now) {
        synchronized (statsLock) {
            executionCount++;
            totalInvalidated += invalidated;
            lastExecuted = now;
        }
    }

    void recordDispatch(long sequence) {
        synchronized (statsLock) {
            lastExecutionSequence = sequence;
        }
    }

    public long getExecutionCount() {
        synchronized (statsLock) {
            return executionCount;
        }
    }

    public long getTotalInvalidated() {
        synchronized (statsLock) {
            return totalInvalidated;
        }
    }

    @Nullable
    public Instant getLastExecuted() {
        synchronized (statsLock) {
            return lastExecuted;
        }
    }

    /**
     * Engine-wide sequence number of the last dispatch of this rule; 0 if never dispatched.
     * Rules dispatched for the same write receive increasing numbers in priority order.
     */
    public long getLastExecutionSequence() {
        synchronized (statsLock) {
            return lastExecutionSequence;
        }
    }
}
