package net.vortexdevelopment.vcache.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MultiLayerCacheTest {

    private CacheStore memory;
    private PersistentBackend backend;
    private MultiLayerCache cache;

    @BeforeEach
    void setUp() {
        memory = new CacheStore(100, Duration.ofMinutes(10));
        backend = mock(PersistentBackend.class);
        when(backend.isEnabled()).thenReturn(true);
        cache = new MultiLayerCache(memory, backend);
    }

    @Test
    void testSetWritesAllLayers() {
        cache.set("k", "v", Duration.ofMinutes(1), Set.of("t"));

        assertThat(memory.peek("k")).isEqualTo("v");
        verify(backend).set("k", "v", Duration.ofMinutes(1), Set.of("t"));
    }

    @Test
    void testSetSelectedLayers() {
        cache.set("k", "v", null, null, EnumSet.of(CacheLayer.MEMORY));

        assertThat(memory.peek("k")).isEqualTo("v");
        verify(backend, never()).set(anyString(), any(), any(), anySet());
    }

    @Test
    void testBackendHitIsWrittenThroughToMemory() {
        when(backend.get("k")).thenReturn("from-backend");

        assertThat(cache.get("k")).isEqualTo("from-backend");
        assertThat(memory.peek("k")).isEqualTo("from-backend");

        // Second read is served by memory
        assertThat(cache.get("k")).isEqualTo("from-backend");
        verify(backend).get("k");
    }

    @Test
    void testBackendFailureDegradesToMiss() {
        when(backend.get(anyString())).thenThrow(new CacheException("connection refused"));
        doThrow(new CacheException("connection refused")).when(backend).set(anyString(), any(), any(), anySet());

        assertThat(cache.get("k")).isNull();

        cache.set("k", "v", null, null);
        assertThat(cache.get("k")).isEqualTo("v");
    }

    @Test
    void testDisabledBackendIsNeverCalled() {
        MultiLayerCache memoryOnly = new MultiLayerCache(memory, new NoOpPersistentBackend());

        memoryOnly.set("k", "v", null, null);

        assertThat(memoryOnly.isPersistentEnabled()).isFalse();
        assertThat(memoryOnly.get("k")).isEqualTo("v");
        assertThat(memoryOnly.delete("k")).isTrue();
        assertThat(memoryOnly.delete("k")).isFalse();
    }

    @Test
    void testGetOrComputeCachesValue() {
        AtomicInteger calls = new AtomicInteger();

        String first = cache.getOrCompute("k", () -> "computed-" + calls.incrementAndGet(), null, Set.of("t"));
        String second = cache.getOrCompute("k", () -> "computed-" + calls.incrementAndGet(), null, Set.of("t"));

        assertThat(first).isEqualTo("computed-1");
        assertThat(second).isEqualTo("computed-1");
        assertThat(calls).hasValue(1);
        verify(backend).set(eq("k"), eq("computed-1"), any(), eq(Set.of("t")));
    }

    @Test
    void testGetOrComputeForceRefresh() {
        cache.set("k", "old", null, null);

        String value = cache.getOrCompute("k", () -> "new", null, null, true);

        assertThat(value).isEqualTo("new");
        assertThat(cache.get("k")).isEqualTo("new");
    }

    @Test
    void testGetOrComputeWrapsFailures() {
        assertThatThrownBy(() -> cache.getOrCompute("k", () -> {
            throw new IllegalStateException("boom");
        }, null, null))
                .isInstanceOf(CacheException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(memory.peek("k")).isNull();
    }

    @Test
    void testGetOrComputeRejectsNull() {
        assertThatThrownBy(() -> cache.getOrCompute("k", () -> null, null, null))
                .isInstanceOf(CacheException.class)
                .hasMessageContaining("null");
    }

    @Test
    void testConcurrentGetOrComputeRunsOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ComputeFunction<String> slow = () -> {
            calls.incrementAndGet();
            computing.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return "value";
        };

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<String> leader = executor.submit(() -> cache.getOrCompute("shared", slow, null, null));
            assertThat(computing.await(5, TimeUnit.SECONDS)).isTrue();

            List<Future<String>> followers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                followers.add(executor.submit(() -> cache.getOrCompute("shared", slow, null, null)));
            }
            // Give the followers time to join the in-flight computation
            Thread.sleep(100);
            release.countDown();

            assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            for (Future<String> follower : followers) {
                assertThat(follower.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            }
            assertThat(calls).hasValue(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testInvalidateByTagsSumsLayers() {
        when(backend.invalidateByTags(Set.of("user"))).thenReturn(3);
        memory.set("a", "v", null, Set.of("user"));
        memory.set("b", "v", null, Set.of("other"));

        assertThat(cache.invalidateByTags(Set.of("user"))).isEqualTo(4);
        assertThat(memory.getAllKeys()).containsExactly("b");
    }

    @Test
    void testInvalidateTagsAndKeys() {
        when(backend.delete(anyString())).thenReturn(false);
        cache.set("a", "v", null, Set.of("t"));
        cache.set("b", "v", null, null);
        cache.set("c", "v", null, null);

        int count = cache.invalidate(Set.of("t"), List.of("b", "missing"));

        assertThat(count).isEqualTo(2);
        assertThat(memory.getAllKeys()).containsExactly("c");
    }

    @Test
    void testMarkStaleRemovesBackendEntries() {
        cache.set("a", "v", null, Set.of("w"));

        assertThat(cache.markStaleByTags(Set.of("w"))).isEqualTo(1);
        verify(backend).invalidateByTags(Set.of("w"));
        assertThat(cache.get("a")).isNull();
    }

    @Test
    void testAccessListenerSeesEveryRead() {
        List<String> seen = new CopyOnWriteArrayList<>();
        cache.addAccessListener(seen::add);
        cache.addAccessListener(key -> {
            throw new IllegalStateException("listener failure");
        });

        cache.get("a");
        cache.get("b");

        assertThat(seen).containsExactly("a", "b");
    }

    @Test
    void testClear() {
        cache.set("a", "v", null, null);

        cache.clear();

        assertThat(memory.size()).isZero();
        verify(backend).clear();
    }
}
