package net.vortexdevelopment.vcache.invalidation;

import net.vortexdevelopment.vcache.cache.CacheStore;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.cache.NoOpPersistentBackend;
import net.vortexdevelopment.vcache.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class InvalidationEngineTest {

    private CacheStore memory;
    private MultiLayerCache cache;
    private InvalidationEngine engine;

    @BeforeEach
    void setUp() {
        memory = new CacheStore(100, Duration.ofMinutes(10));
        cache = new MultiLayerCache(memory, new NoOpPersistentBackend());
        engine = new InvalidationEngine(cache, new DependencyTracker(), 500,
                InvalidationEngine.DEFAULT_RELATED_TAG_DEPTH, new MutableClock());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void testWriteInvalidatesEntriesTaggedWithTheResource() {
        cache.set("profile:1", "p1", null, Set.of("user:1"));
        cache.set("profile:2", "p2", null, Set.of("user:2"));
        cache.set("users", "all", null, Set.of("user"));

        int count = engine.invalidateByWrite("user", "1");

        assertThat(count).isEqualTo(2);
        assertThat(memory.getAllKeys()).containsExactly("profile:2");
    }

    @Test
    void testRelatedTagsFollowRelationships() {
        DefaultInvalidationRules.install(engine);

        assertThat(engine.getRelatedTags("user", "1", 2))
                .contains("user", "user:1", "user_session", "user_session:1", "navigation:1")
                .doesNotContain("form_state");
        assertThat(engine.getRelatedTags("form", "9", 2)).contains("form_state:9", "widget_state");
        assertThat(engine.getRelatedTags("form", "9", 1)).contains("form_state:9", "widget_state");
        assertThat(engine.getRelatedTags("user", null, 0)).containsExactly("user");
    }

    @Test
    void testRelatedTagExpansionStopsOnCycles() {
        engine.registerRelationship(DataRelationship.builder()
                .sourceType("a").targetTypes(Set.of("b")).cascadeDepth(5).build());
        engine.registerRelationship(DataRelationship.builder()
                .sourceType("b").targetTypes(Set.of("a")).cascadeDepth(5).build());

        assertThat(engine.getRelatedTags("a", "1", 5)).containsExactlyInAnyOrder("a", "a:1", "b", "b:1");
    }

    @Test
    void testDefaultDepthRelationshipAddsDirectTargets() {
        engine.registerRelationship(DataRelationship.builder()
                .sourceType("user").targetTypes(Set.of("user_session")).build());
        engine.registerRule(InvalidationRule.builder()
                .name("user_changed")
                .triggerTag(ResourceTag.of("user"))
                .invalidateTag("user_profile")
                .build());
        cache.set("sess", "s", null, Set.of("user_session"));

        assertThat(engine.getRelatedTags("user", "42", 2)).contains("user_session", "user_session:42");

        engine.invalidateByWrite("user", "42");

        assertThat(memory.peek("sess")).isNull();
    }

    @Test
    void testCascadeDepthLimitsRecursion() {
        engine.registerRelationship(DataRelationship.builder()
                .sourceType("order").targetTypes(Set.of("invoice")).build());
        engine.registerRelationship(DataRelationship.builder()
                .sourceType("invoice").targetTypes(Set.of("report")).build());

        assertThat(engine.getRelatedTags("order", "1", 3))
                .containsExactlyInAnyOrder("order", "order:1", "invoice", "invoice:1");

        engine.registerRelationship(DataRelationship.builder()
                .sourceType("order").targetTypes(Set.of("invoice")).cascadeDepth(2).build());

        assertThat(engine.getRelatedTags("order", "1", 3)).contains("report", "report:1");
        assertThat(engine.getRelatedTags("order", "1", 1)).doesNotContain("report");
    }

    @Test
    void testDefaultUserRuleClearsSessionData() {
        DefaultInvalidationRules.install(engine);
        cache.set("user_session:1", "s", null, Set.of("user_session:1"));
        cache.set("navigation:1", "n", null, Set.of("navigation"));
        cache.set("user_session:2", "s", null, Set.of("user_session:2"));

        engine.invalidateByWrite("user", "1");

        assertThat(memory.getAllKeys()).containsExactly("user_session:2");
        InvalidationRule rule = engine.getRule("user_data_invalidation");
        assertThat(rule.getExecutionCount()).isEqualTo(1);
        assertThat(rule.getLastExecuted()).isNotNull();
    }

    @Test
    void testRulesDispatchInPriorityOrder() {
        engine.registerRule(rule("low", 10, InvalidationStrategy.IMMEDIATE));
        engine.registerRule(rule("high", 50, InvalidationStrategy.IMMEDIATE));
        engine.registerRule(rule("mid", 30, InvalidationStrategy.IMMEDIATE));

        engine.invalidateByWrite("order", "1");

        long high = engine.getRule("high").getLastExecutionSequence();
        long mid = engine.getRule("mid").getLastExecutionSequence();
        long low = engine.getRule("low").getLastExecutionSequence();
        assertThat(high).isPositive();
        assertThat(high).isLessThan(mid);
        assertThat(mid).isLessThan(low);
        assertThat(engine.getStats().getRuleDetails())
                .extracting(RuleStats::getName)
                .containsExactly("high", "mid", "low");
    }

    @Test
    void testRuleWithIdTriggerOnlyMatchesThatResource() {
        engine.registerRule(InvalidationRule.builder()
                .name("vip_order")
                .triggerTag(ResourceTag.of("order", "vip"))
                .invalidateTag("dashboard")
                .build());
        cache.set("dashboard", "d", null, Set.of("dashboard"));

        engine.invalidateByWrite("order", "1");
        assertThat(memory.peek("dashboard")).isEqualTo("d");

        engine.invalidateByWrite("order", "vip");
        assertThat(memory.peek("dashboard")).isNull();
    }

    @Test
    void testBatchedRulesAreCoalesced() {
        engine.registerRule(InvalidationRule.builder()
                .name("form_batch")
                .triggerTag(ResourceTag.of("form"))
                .invalidateTag("form_state")
                .strategy(InvalidationStrategy.BATCHED)
                .build());
        cache.set("form_state:1", "s1", null, Set.of("form_state"));
        cache.set("form_state:2", "s2", null, Set.of("form_state"));

        engine.invalidateByWrite("form", "1");
        engine.invalidateByWrite("form", "2");

        // Still pending until the debounce timer fires
        assertThat(memory.size()).isEqualTo(2);
        assertThat(engine.getStats().getPendingTags()).isEqualTo(1);

        await().atMost(Duration.ofSeconds(5)).until(() -> memory.size() == 0);
        InvalidationStats stats = engine.getStats();
        assertThat(stats.getBatchExecutions()).isEqualTo(1);
        assertThat(stats.getBatchedInvalidations()).isEqualTo(2);
        assertThat(stats.getPendingTags()).isZero();
        assertThat(stats.getTotalInvalidations()).isEqualTo(2);
    }

    @Test
    void testFlushPending() {
        engine.setBatchDelay(InvalidationEngine.MAX_BATCH_DELAY_MS);
        cache.set("a", "v", null, Set.of("t"));
        cache.set("b", "v", null, null);

        engine.scheduleBatchInvalidation(Set.of("t"), List.of("b"));

        assertThat(engine.flushPending()).isEqualTo(2);
        assertThat(memory.size()).isZero();
        assertThat(engine.flushPending()).isZero();
        assertThat(engine.getStats().getBatchExecutions()).isEqualTo(1);
    }

    @Test
    void testShutdownFlushesPending() {
        engine.setBatchDelay(InvalidationEngine.MAX_BATCH_DELAY_MS);
        cache.set("a", "v", null, Set.of("t"));

        engine.scheduleBatchInvalidation(Set.of("t"), null);
        engine.shutdown();

        assertThat(memory.size()).isZero();
    }

    @Test
    void testLazyRuleMarksEntriesStale() {
        engine.registerRule(InvalidationRule.builder()
                .name("widget_lazy")
                .triggerTag(ResourceTag.of("widget"))
                .invalidateTag("widget_view")
                .strategy(InvalidationStrategy.LAZY)
                .build());
        cache.set("view:1", "v", null, Set.of("widget_view"));

        int count = engine.invalidateByWrite("widget", "7");

        assertThat(count).isEqualTo(1);
        assertThat(memory.size()).isEqualTo(1);
        assertThat(cache.get("view:1")).isNull();
        assertThat(engine.getStats().getLazyInvalidations()).isEqualTo(1);
    }

    @Test
    void testCascadeRuleFollowsDependencies() {
        engine.registerRule(InvalidationRule.builder()
                .name("product_cascade")
                .triggerTag(ResourceTag.of("product"))
                .invalidateTag("computed")
                .strategy(InvalidationStrategy.CASCADE)
                .build());
        cache.set("computed:price", "10", null, Set.of("computed"));
        cache.set("report:sales", "r", null, null);
        cache.set("report:summary", "s", null, null);
        cache.set("unrelated", "u", null, null);
        engine.addDependency("report:sales", List.of("computed:price"));
        engine.addDependency("report:summary", List.of("report:sales"));

        int count = engine.invalidateByWrite("product", "1");

        assertThat(memory.getAllKeys()).containsExactly("unrelated");
        assertThat(count).isEqualTo(3);
        assertThat(engine.getDependencyTracker().size()).isZero();
        assertThat(engine.getStats().getCascadeInvalidations()).isEqualTo(1);
    }

    @Test
    void testInvalidateWithDependenciesNonRecursive() {
        cache.set("base", "v", null, null);
        cache.set("child", "v", null, null);
        cache.set("grandchild", "v", null, null);
        engine.addDependency("child", List.of("base"));
        engine.addDependency("grandchild", List.of("child"));

        assertThat(engine.invalidateWithDependencies("base", false)).isEqualTo(2);
        assertThat(memory.getAllKeys()).containsExactly("grandchild");
        assertThat(engine.getDependencyTracker().getDependents("child")).containsExactly("grandchild");
    }

    @Test
    void testPatternRuleMatchesKeyPrefix() {
        engine.registerRule(InvalidationRule.builder()
                .name("reports")
                .triggerTag(ResourceTag.of("order"))
                .pattern(Pattern.compile("report:"))
                .build());
        cache.set("report:1", "v", null, null);
        cache.set("report:2", "v", null, null);
        cache.set("summary:report:3", "v", null, null);

        assertThat(engine.invalidateByWrite("order", "1")).isEqualTo(2);
        assertThat(memory.getAllKeys()).containsExactly("summary:report:3");
    }

    @Test
    void testConditionGuardsRule() {
        engine.registerRule(InvalidationRule.builder()
                .name("published_only")
                .triggerTag(ResourceTag.of("article"))
                .invalidateTag("feed")
                .condition(context -> "published".equals(context.getAttribute("status")))
                .build());
        cache.set("feed", "f", null, Set.of("feed"));

        engine.invalidateByWrite("article", "1", WriteOperation.UPDATE, Map.of("status", "draft"));
        assertThat(memory.peek("feed")).isEqualTo("f");

        engine.invalidateByWrite(WriteContext.builder()
                .resourceType("article")
                .resourceId("1")
                .attribute("status", "published")
                .build());
        assertThat(memory.peek("feed")).isNull();
    }

    @Test
    void testFailingConditionSkipsRule() {
        engine.registerRule(InvalidationRule.builder()
                .name("broken")
                .triggerTag(ResourceTag.of("article"))
                .invalidateTag("feed")
                .condition(context -> {
                    throw new IllegalStateException("lookup failed");
                })
                .build());
        engine.registerRule(rule("healthy", 0, InvalidationStrategy.IMMEDIATE));
        cache.set("feed", "f", null, Set.of("feed"));

        engine.invalidateByWrite("article", "1");
        engine.invalidateByWrite("order", "1");

        assertThat(memory.peek("feed")).isEqualTo("f");
        assertThat(engine.getRule("broken").getExecutionCount()).isZero();
        assertThat(engine.getRule("healthy").getExecutionCount()).isEqualTo(1);
    }

    @Test
    void testRegisterReplacesAndUnregisterRemoves() {
        engine.registerRule(rule("r", 1, InvalidationStrategy.IMMEDIATE));
        engine.registerRule(rule("r", 2, InvalidationStrategy.IMMEDIATE));

        assertThat(engine.getStats().getRules()).isEqualTo(1);
        assertThat(engine.getRule("r").getPriority()).isEqualTo(2);

        assertThat(engine.unregisterRule("r")).isTrue();
        assertThat(engine.unregisterRule("r")).isFalse();
        engine.invalidateByWrite("order", "1");
        assertThat(engine.getStats().getImmediateInvalidations()).isZero();
    }

    @Test
    void testBatchDelayIsClamped() {
        engine.setBatchDelay(1);
        assertThat(engine.getBatchDelay()).isEqualTo(InvalidationEngine.MIN_BATCH_DELAY_MS);

        engine.setBatchDelay(60_000);
        assertThat(engine.getBatchDelay()).isEqualTo(InvalidationEngine.MAX_BATCH_DELAY_MS);
    }

    @Test
    void testDefaultRulesStats() {
        DefaultInvalidationRules.install(engine);

        InvalidationStats stats = engine.getStats();
        assertThat(stats.getRules()).isEqualTo(6);
        assertThat(stats.getRelationships()).isEqualTo(3);
        assertThat(stats.getRuleDetails().get(0).getName()).isEqualTo("user_data_invalidation");
    }

    private static InvalidationRule rule(String name, int priority, InvalidationStrategy strategy) {
        return InvalidationRule.builder()
                .name(name)
                .triggerTag(ResourceTag.of("order"))
                .invalidateTag("order_view")
                .strategy(strategy)
                .priority(priority)
                .build();
    }
}
