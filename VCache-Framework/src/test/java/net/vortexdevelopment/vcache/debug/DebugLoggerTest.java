package net.vortexdevelopment.vcache.debug;

import net.vortexdevelopment.vcache.cache.CacheStore;
import net.vortexdevelopment.vcache.invalidation.DependencyTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class DebugLoggerTest {

    @AfterEach
    void tearDown() {
        DebugLogger.clearAll();
    }

    @Test
    void testEnableDebugForSelectedClassesOnly() {
        DebugLogger.enableDebugFor(CacheStore.class);

        assertThat(DebugLogger.isEnabled(CacheStore.class)).isTrue();
        assertThat(DebugLogger.isEnabled(DependencyTracker.class)).isFalse();
    }

    @Test
    void testClearAllDisablesClasses() {
        DebugLogger.enableDebugFor(CacheStore.class, DependencyTracker.class);
        DebugLogger.clearAll();

        assertThat(DebugLogger.isEnabled(CacheStore.class)).isFalse();
        assertThat(DebugLogger.isEnabled(DependencyTracker.class)).isFalse();
    }

    @Test
    void testTracingEnabledClassDoesNotAffectBehavior() {
        DebugLogger.enableDebugFor(DependencyTracker.class);
        DependencyTracker tracker = new DependencyTracker();

        assertThatCode(() -> tracker.addDependency("report:1", List.of("user:1"))).doesNotThrowAnyException();
        assertThat(tracker.getDependents("user:1")).containsExactly("report:1");

        assertThatCode(() -> DebugLogger.log(DebugLoggerTest.class, "plain message without args"))
                .doesNotThrowAnyException();
    }
}
