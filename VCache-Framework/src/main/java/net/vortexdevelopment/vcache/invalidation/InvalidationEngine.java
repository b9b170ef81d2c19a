package net.vortexdevelopment.vcache.invalidation;

import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.debug.DebugLogger;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Relationship-aware invalidation engine.
 * <p>
 * A write to a resource is expanded into related tags through registered
 * {@link DataRelationship}s, matching {@link InvalidationRule}s are dispatched in priority
 * order according to their {@link InvalidationStrategy}, and every live entry carrying a
 * related tag is invalidated. Batched rules are coalesced by a debounce timer that restarts
 * on every new request.
 */
@Slf4j
public class InvalidationEngine {

    public static final long DEFAULT_BATCH_DELAY_MS = 100;
    public static final long MIN_BATCH_DELAY_MS = 10;
    public static final long MAX_BATCH_DELAY_MS = 5000;
    public static final int DEFAULT_RELATED_TAG_DEPTH = 2;

    private final MultiLayerCache cache;
    private final DependencyTracker dependencyTracker;
    private final Clock clock;
    private final int relatedTagDepth;

    private final Map<String, InvalidationRule> rules = new LinkedHashMap<>();
    private final Map<String, Set<String>> writeTriggers = new HashMap<>();
    private final Map<String, List<DataRelationship>> relationships = new LinkedHashMap<>();
    private final Set<String> pendingTags = new LinkedHashSet<>();
    private final Set<String> pendingKeys = new LinkedHashSet<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong dispatchSequence = new AtomicLong();
    private final ScheduledExecutorService batchScheduler;

    @Nullable
    private ScheduledFuture<?> batchTimer;
    private long batchDelayMs;

    private long totalInvalidations;
    private long immediateInvalidations;
    private long batchedInvalidations;
    private long cascadeInvalidations;
    private long lazyInvalidations;
    private long batchExecutions;

    public InvalidationEngine(MultiLayerCache cache) {
        this(cache, new DependencyTracker(), DEFAULT_BATCH_DELAY_MS, DEFAULT_RELATED_TAG_DEPTH, Clock.systemUTC());
    }

    public InvalidationEngine(MultiLayerCache cache, DependencyTracker dependencyTracker, long batchDelayMs,
                              int relatedTagDepth, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.dependencyTracker = Objects.requireNonNull(dependencyTracker, "dependencyTracker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.relatedTagDepth = relatedTagDepth;
        this.batchDelayMs = clampBatchDelay(batchDelayMs);
        this.batchScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "vcache-invalidation-batch");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Register a rule, replacing any rule with the same name. The rule is indexed by the
     * type of each trigger tag and its relationships are registered with the engine.
     */
    public void registerRule(InvalidationRule rule) {
        Objects.requireNonNull(rule, "rule");
        lock.lock();
        try {
            if (rules.containsKey(rule.getName())) {
                removeFromIndex(rule.getName());
            }
            rules.put(rule.getName(), rule);
            for (ResourceTag tag : rule.getTriggerTags()) {
                writeTriggers.computeIfAbsent(tag.getType(), k -> new LinkedHashSet<>()).add(rule.getName());
            }
            for (DataRelationship relationship : rule.getRelationships()) {
                addRelationship(relationship);
            }
            log.info("Invalidation rule registered rule={} strategy={} priority={} triggerTags={} invalidateTags={} relationships={}",
                    rule.getName(), rule.getStrategy().id(), rule.getPriority(), rule.getTriggerTagNames(),
                    rule.getInvalidateTags(), rule.getRelationships().size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if a rule with that name was registered
     */
    public boolean unregisterRule(String ruleName) {
        lock.lock();
        try {
            if (rules.remove(ruleName) == null) {
                return false;
            }
            removeFromIndex(ruleName);
            log.info("Invalidation rule unregistered rule={}", ruleName);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Nullable
    public InvalidationRule getRule(String ruleName) {
        lock.lock();
        try {
            return rules.get(ruleName);
        } finally {
            lock.unlock();
        }
    }

    public void registerRelationship(DataRelationship relationship) {
        Objects.requireNonNull(relationship, "relationship");
        lock.lock();
        try {
            addRelationship(relationship);
            log.info("Data relationship registered source={} targets={} type={}",
                    relationship.getSourceType(), relationship.getTargetTypes(), relationship.getRelationshipType());
        } finally {
            lock.unlock();
        }
    }

    public void addDependency(String key, Collection<String> dependsOn) {
        dependencyTracker.addDependency(key, dependsOn);
    }

    public DependencyTracker getDependencyTracker() {
        return dependencyTracker;
    }

    /**
     * Expand a resource into the tags of everything derived from it.
     * The result always contains {@code type} and, with an id, {@code type:id}. With a
     * positive {@code depth}, each relationship of {@code type} adds its target tags, and target
     * types are expanded again with {@code min(cascadeDepth, depth) - 1}. A type is expanded at
     * most once per call.
     */
    public Set<String> getRelatedTags(String resourceType, @Nullable String resourceId, int depth) {
        lock.lock();
        try {
            Set<String> tags = new LinkedHashSet<>();
            collectRelatedTags(resourceType, resourceId, depth, tags, new HashSet<>());
            return tags;
        } finally {
            lock.unlock();
        }
    }

    private void collectRelatedTags(String type, @Nullable String id, int depth, Set<String> tags, Set<String> visited) {
        ResourceTag tag = ResourceTag.of(type, id);
        tags.add(tag.getType());
        if (tag.hasId()) {
            tags.add(tag.toString());
        }
        if (depth <= 0 || !visited.add(type)) {
            return;
        }
        for (DataRelationship relationship : relationships.getOrDefault(type, List.of())) {
            tags.addAll(relationship.relatedTags(tag.getId()));
            int remaining = Math.min(relationship.getCascadeDepth(), depth) - 1;
            if (remaining > 0) {
                for (String targetType : relationship.getTargetTypes()) {
                    collectRelatedTags(targetType, tag.getId(), remaining, tags, visited);
                }
            }
        }
    }

    public int invalidateByWrite(String resourceType, @Nullable String resourceId) {
        return invalidateByWrite(WriteContext.builder()
                .resourceType(resourceType)
                .resourceId(resourceId)
                .build());
    }

    public int invalidateByWrite(String resourceType, @Nullable String resourceId, WriteOperation operation,
                                 @Nullable Map<String, Object> attributes) {
        return invalidateByWrite(WriteContext.builder()
                .resourceType(resourceType)
                .resourceId(resourceId)
                .operation(operation == null ? WriteOperation.UPDATE : operation)
                .attributes(attributes == null ? Map.of() : attributes)
                .build());
    }

    /**
     * Invalidate cache entries affected by a data write.
     *
     * @return number of entries invalidated by rules, cascades and the related-tag sweep
     */
    public int invalidateByWrite(WriteContext context) {
        Objects.requireNonNull(context, "context");
        String resourceType = context.getResourceType();
        Set<String> relatedTags = getRelatedTags(resourceType, context.getResourceId(), relatedTagDepth);

        List<InvalidationRule> candidates = new ArrayList<>();
        lock.lock();
        try {
            for (String ruleName : writeTriggers.getOrDefault(resourceType, Set.of())) {
                InvalidationRule rule = rules.get(ruleName);
                if (rule != null && rule.isTriggeredBy(relatedTags)) {
                    candidates.add(rule);
                }
            }
        } finally {
            lock.unlock();
        }
        // List.sort is stable, ties keep registration order
        candidates.sort(Comparator.comparingInt(InvalidationRule::getPriority).reversed());

        int total = 0;
        int immediate = 0;
        int batched = 0;
        int cascade = 0;
        int lazy = 0;
        for (InvalidationRule rule : candidates) {
            if (!conditionHolds(rule, context)) {
                continue;
            }
            rule.recordDispatch(dispatchSequence.incrementAndGet());
            switch (rule.getStrategy()) {
                case IMMEDIATE:
                    total += executeRule(rule, context);
                    immediate++;
                    break;
                case BATCHED:
                    scheduleBatchInvalidation(rule.getInvalidateTags(), null);
                    batched++;
                    break;
                case LAZY:
                    total += executeLazy(rule, context);
                    lazy++;
                    break;
                case CASCADE:
                    total += executeCascade(rule, context);
                    cascade++;
                    break;
                default:
                    throw new IllegalStateException("Unknown strategy " + rule.getStrategy());
            }
        }

        total += cache.invalidateByTags(relatedTags);

        lock.lock();
        try {
            totalInvalidations += total;
            immediateInvalidations += immediate;
            batchedInvalidations += batched;
            cascadeInvalidations += cascade;
            lazyInvalidations += lazy;
        } finally {
            lock.unlock();
        }

        log.info("Cache invalidated by write resourceType={} resourceId={} operation={} rulesMatched={} immediate={} batched={} cascade={} lazy={} totalInvalidated={}",
                resourceType, context.getResourceId(), context.getOperation(), candidates.size(),
                immediate, batched, cascade, lazy, total);
        return total;
    }

    private boolean conditionHolds(InvalidationRule rule, WriteContext context) {
        try {
            return rule.shouldExecute(context);
        } catch (Exception e) {
            log.warn("Invalidation rule condition failed rule={} error={}", rule.getName(), e.getMessage(), e);
            return false;
        }
    }

    private Set<String> tagsFor(InvalidationRule rule, WriteContext context) {
        Set<String> tags = new LinkedHashSet<>(rule.getInvalidateTags());
        for (DataRelationship relationship : rule.getRelationships()) {
            tags.addAll(relationship.relatedTags(context.getResourceId()));
        }
        return tags;
    }

    private int executeRule(InvalidationRule rule, WriteContext context) {
        Pattern pattern = rule.getPattern();
        Set<String> tags = tagsFor(rule, context);
        int count;
        if (pattern != null) {
            List<String> matchingKeys = new ArrayList<>();
            for (String key : cache.getMemoryStore().getAllKeys()) {
                if (pattern.matcher(key).lookingAt()) {
                    matchingKeys.add(key);
                }
            }
            count = matchingKeys.isEmpty() ? 0 : cache.invalidate(null, matchingKeys);
        } else {
            count = cache.invalidateByTags(tags);
        }
        rule.recordExecution(count, clock.instant());
        log.info("Invalidation rule executed rule={} strategy={} invalidated={} invalidateTags={}",
                rule.getName(), rule.getStrategy().id(), count, pattern != null ? pattern.pattern() : tags);
        return count;
    }

    private int executeLazy(InvalidationRule rule, WriteContext context) {
        int count = cache.markStaleByTags(tagsFor(rule, context));
        rule.recordExecution(count, clock.instant());
        DebugLogger.log("Rule %s marked %d entries stale", rule.getName(), count);
        return count;
    }

    private int executeCascade(InvalidationRule rule, WriteContext context) {
        List<String> affectedKeys = cache.getMemoryStore().getKeysWithAnyTag(rule.getInvalidateTags());
        int total = executeRule(rule, context);
        for (String key : affectedKeys) {
            total += invalidateWithDependencies(key, true);
        }
        return total;
    }

    /**
     * Invalidate a key together with the keys depending on it.
     *
     * @param recursive false to include direct dependents only
     * @return number of entries invalidated
     */
    public int invalidateWithDependencies(String key, boolean recursive) {
        Set<String> dependents = dependencyTracker.getAllDependents(key, recursive);
        Set<String> keys = new LinkedHashSet<>();
        keys.add(key);
        keys.addAll(dependents);

        int count = cache.invalidate(null, keys);
        for (String invalidated : keys) {
            dependencyTracker.removeOutgoing(invalidated);
        }
        log.info("Cache invalidated with dependencies key={} dependents={} totalInvalidated={}",
                key, dependents.size(), count);
        return count;
    }

    /**
     * Merge tags and keys into the pending batch and restart the debounce timer.
     */
    public void scheduleBatchInvalidation(@Nullable Collection<String> tags, @Nullable Collection<String> keys) {
        lock.lock();
        try {
            if (tags != null) {
                pendingTags.addAll(tags);
            }
            if (keys != null) {
                pendingKeys.addAll(keys);
            }
            if (batchTimer != null) {
                batchTimer.cancel(false);
            }
            batchTimer = batchScheduler.schedule(this::executeBatch, batchDelayMs, TimeUnit.MILLISECONDS);
            DebugLogger.log("Batch invalidation scheduled, pending tags=%d keys=%d",
                    pendingTags.size(), pendingKeys.size());
        } finally {
            lock.unlock();
        }
    }

    private void executeBatch() {
        try {
            int count = runPendingBatch();
            if (count >= 0) {
                log.info("Batch invalidation executed invalidated={}", count);
            }
        } catch (RuntimeException e) {
            log.error("Batch invalidation failed error={}", e.getMessage(), e);
        }
    }

    /**
     * Cancel the debounce timer and execute pending invalidations now.
     *
     * @return number of entries invalidated, 0 when nothing was pending
     */
    public int flushPending() {
        lock.lock();
        try {
            if (batchTimer != null) {
                batchTimer.cancel(false);
                batchTimer = null;
            }
        } finally {
            lock.unlock();
        }
        int count = runPendingBatch();
        if (count < 0) {
            return 0;
        }
        log.info("Pending invalidations flushed count={}", count);
        return count;
    }

    /**
     * @return entries invalidated, or -1 when nothing was pending
     */
    private int runPendingBatch() {
        Set<String> tags;
        List<String> keys;
        lock.lock();
        try {
            if (pendingTags.isEmpty() && pendingKeys.isEmpty()) {
                return -1;
            }
            tags = new LinkedHashSet<>(pendingTags);
            keys = new ArrayList<>(pendingKeys);
            pendingTags.clear();
            pendingKeys.clear();
            batchTimer = null;
            batchExecutions++;
        } finally {
            lock.unlock();
        }

        int count = cache.invalidate(tags, keys);

        lock.lock();
        try {
            totalInvalidations += count;
        } finally {
            lock.unlock();
        }
        return count;
    }

    /**
     * Set the debounce delay, clamped to [10, 5000] ms.
     */
    public void setBatchDelay(long delayMs) {
        lock.lock();
        try {
            batchDelayMs = clampBatchDelay(delayMs);
            log.info("Batch delay updated delayMs={}", batchDelayMs);
        } finally {
            lock.unlock();
        }
    }

    public long getBatchDelay() {
        lock.lock();
        try {
            return batchDelayMs;
        } finally {
            lock.unlock();
        }
    }

    public InvalidationStats getStats() {
        lock.lock();
        try {
            List<InvalidationRule> byPriority = new ArrayList<>(rules.values());
            byPriority.sort(Comparator.comparingInt(InvalidationRule::getPriority).reversed());
            List<RuleStats> ruleDetails = new ArrayList<>();
            for (InvalidationRule rule : byPriority) {
                ruleDetails.add(RuleStats.of(rule));
            }
            List<DataRelationship> relationshipDetails = new ArrayList<>();
            relationships.values().forEach(relationshipDetails::addAll);

            return InvalidationStats.builder()
                    .rules(rules.size())
                    .relationships(relationshipDetails.size())
                    .pendingTags(pendingTags.size())
                    .pendingKeys(pendingKeys.size())
                    .batchDelayMs(batchDelayMs)
                    .totalInvalidations(totalInvalidations)
                    .immediateInvalidations(immediateInvalidations)
                    .batchedInvalidations(batchedInvalidations)
                    .cascadeInvalidations(cascadeInvalidations)
                    .lazyInvalidations(lazyInvalidations)
                    .batchExecutions(batchExecutions)
                    .ruleDetails(ruleDetails)
                    .relationshipDetails(relationshipDetails)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flush pending invalidations and stop the debounce timer thread.
     */
    public void shutdown() {
        flushPending();
        batchScheduler.shutdownNow();
        log.info("Invalidation engine shut down");
    }

    private void addRelationship(DataRelationship relationship) {
        List<DataRelationship> list = relationships.computeIfAbsent(relationship.getSourceType(), k -> new ArrayList<>());
        if (!list.contains(relationship)) {
            list.add(relationship);
        }
    }

    private void removeFromIndex(String ruleName) {
        writeTriggers.values().forEach(names -> names.remove(ruleName));
        writeTriggers.values().removeIf(Set::isEmpty);
    }

    private static long clampBatchDelay(long delayMs) {
        return Math.max(MIN_BATCH_DELAY_MS, Math.min(delayMs, MAX_BATCH_DELAY_MS));
    }
}
