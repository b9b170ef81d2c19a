package net.vortexdevelopment.vcache.invalidation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of {@link InvalidationEngine} state and counters.
 */
@Value
@Builder
public class InvalidationStats {
    int rules;
    int relationships;
    int pendingTags;
    int pendingKeys;
    long batchDelayMs;
    long totalInvalidations;
    long immediateInvalidations;
    long batchedInvalidations;
    long cascadeInvalidations;
    long lazyInvalidations;
    /** Number of consolidated batch runs, from the timer or {@code flushPending}. */
    long batchExecutions;
    /** Rule details, highest priority first. */
    List<RuleStats> ruleDetails;
    List<DataRelationship> relationshipDetails;
}
