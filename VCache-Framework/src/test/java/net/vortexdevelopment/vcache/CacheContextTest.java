package net.vortexdevelopment.vcache;

import net.vortexdevelopment.vcache.cache.CacheException;
import net.vortexdevelopment.vcache.cache.CacheKeys;
import net.vortexdevelopment.vcache.cache.PersistentBackend;
import net.vortexdevelopment.vcache.cache.backend.CacheDatabase;
import net.vortexdevelopment.vcache.config.CacheSystemConfig;
import net.vortexdevelopment.vcache.invalidation.WriteOperation;
import net.vortexdevelopment.vcache.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheContextTest {

    @Test
    void testDefaultRulesInvalidateOnWrite() {
        try (CacheContext context = CacheContext.builder().clock(new MutableClock()).build()) {
            context.getCache().set(CacheKeys.userSession("1"), "s1", null, Set.of("user_session:1"));
            context.getCache().set(CacheKeys.userSession("2"), "s2", null, Set.of("user_session:2"));

            int count = context.recordWrite("user", "1");

            assertThat(count).isPositive();
            assertThat(context.getCache().get(CacheKeys.userSession("1"))).isNull();
            assertThat(context.getCache().get(CacheKeys.userSession("2"))).isEqualTo("s2");
            assertThat(context.getInvalidationEngine().getStats().getRules()).isEqualTo(6);
        }
    }

    @Test
    void testWithoutDefaultRules() {
        CacheSystemConfig config = CacheSystemConfig.builder().installDefaultRules(false).build();
        try (CacheContext context = CacheContext.builder().config(config).build()) {
            context.getCache().set("feed", "f", null, Set.of("article:3"));

            context.recordWrite("article", "3", WriteOperation.DELETE, Map.of());

            assertThat(context.getInvalidationEngine().getStats().getRules()).isZero();
            assertThat(context.getCache().get("feed")).isNull();
        }
    }

    @Test
    void testReadsFeedUsageTracker() {
        try (CacheContext context = CacheContext.builder().build()) {
            context.getCache().set("k", "v", null, null);
            context.getCache().get("k");
            context.getCache().get("k");
            context.getCache().getOrCompute("other", () -> "computed", null, null);

            assertThat(context.getUsageTracker().getAccessCount("k")).isEqualTo(2);
            assertThat(context.getUsageTracker().getAccessCount("other")).isEqualTo(1);
            assertThat(context.getWarmingEngine().getUsageTracker()).isSameAs(context.getUsageTracker());
        }
    }

    @Test
    void testPersistentLayerFromConfig() {
        CacheSystemConfig config = CacheSystemConfig.builder()
                .memoryMaxEntries(10)
                .persistentEnabled(true)
                .databaseName("ctx_" + UUID.randomUUID().toString().replace("-", ""))
                .databaseMaxPoolSize(2)
                .build();
        try (CacheContext context = CacheContext.builder().config(config).build()) {
            context.getCache().set("k", Map.of("a", 1), null, Set.of("t"));
            context.getMemoryStore().clear();

            assertThat(context.getCache().isPersistentEnabled()).isTrue();
            assertThat(context.getCache().get("k")).isEqualTo(Map.of("a", 1));
        }
    }

    @Test
    void testCustomBackend() {
        PersistentBackend backend = mock(PersistentBackend.class);
        when(backend.isEnabled()).thenReturn(true);
        try (CacheContext context = CacheContext.builder().persistentBackend(backend).build()) {
            context.getCache().set("k", "v", Duration.ofMinutes(1), null);

            assertThat(context.getPersistentBackend()).isSameAs(backend);
            verify(backend).set(eq("k"), eq("v"), any(), any());
        }
    }

    @Test
    void testStartAndClose() {
        CacheSystemConfig config = CacheSystemConfig.builder()
                .monitoringEnabled(true)
                .monitorInterval(Duration.ofSeconds(1))
                .warmingEnabled(true)
                .warmingInterval(Duration.ofMinutes(1))
                .build();
        CacheContext context = CacheContext.builder().config(config).build();

        context.start();
        assertThat(context.getMonitor().isRunning()).isTrue();
        assertThat(context.getWarmingEngine().isRunning()).isTrue();

        context.close();
        assertThat(context.getMonitor().isRunning()).isFalse();
        assertThat(context.getWarmingEngine().isRunning()).isFalse();
    }

    @Test
    void testDatabasePoolClosedWhenCacheTableSetupFails() {
        CacheDatabase database = mock(CacheDatabase.class);
        doThrow(new CacheException("table creation failed"))
                .when(database).connect(any(CacheDatabase.VoidConnection.class));

        assertThatThrownBy(() -> CacheContext.openJdbcBackend(database, CacheSystemConfig.defaults(), Clock.systemUTC()))
                .isInstanceOf(CacheException.class)
                .hasMessage("table creation failed");

        verify(database).init();
        verify(database).shutdown();
    }
}
