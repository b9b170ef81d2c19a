package net.vortexdevelopment.vcache.monitor;

import net.vortexdevelopment.vcache.cache.CacheStore;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.cache.NoOpPersistentBackend;
import net.vortexdevelopment.vcache.monitor.report.CleanupResult;
import net.vortexdevelopment.vcache.monitor.report.DegradationReport;
import net.vortexdevelopment.vcache.monitor.report.DetailedMetrics;
import net.vortexdevelopment.vcache.monitor.report.EvictionReport;
import net.vortexdevelopment.vcache.monitor.report.HitRateReport;
import net.vortexdevelopment.vcache.monitor.report.PerformanceReport;
import net.vortexdevelopment.vcache.monitor.report.SizeReport;
import net.vortexdevelopment.vcache.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerformanceAnalyzerTest {

    private MutableClock clock;
    private CacheStore memory;
    private MultiLayerCache cache;
    private MetricsCollector collector;
    private PerformanceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        memory = new CacheStore(10, Duration.ofMinutes(5), clock);
        cache = new MultiLayerCache(memory, new NoOpPersistentBackend());
        collector = new MetricsCollector(1000, clock);
        analyzer = new PerformanceAnalyzer(cache, collector, AlertThresholds.builder().evictionRateHigh(10).build(), clock);
    }

    @Test
    void testLowHitRateNeedsEnoughRequests() {
        missTimes(99);
        HitRateReport report = analyzer.analyzeHitRate();

        assertThat(report.getHitRate()).isZero();
        assertThat(report.getStatus()).isEqualTo(HealthStatus.POOR);
        assertThat(analyzer.getActiveAlerts()).isEmpty();

        missTimes(1);
        analyzer.analyzeHitRate();

        List<CacheAlert> alerts = analyzer.getActiveAlerts();
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getMetricType()).isEqualTo(MetricType.HIT_RATE);
        assertThat(alerts.get(0).getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(alerts.get(0).getId()).matches("hit_rate_\\d+_\\d+");
    }

    @Test
    void testHitRateRecordsHitAndMissRate() {
        cache.set("k", "v", null, null);
        cache.get("k");
        cache.get("k");
        cache.get("k");
        cache.get("missing");

        HitRateReport report = analyzer.analyzeHitRate();

        assertThat(report.getHitRate()).isEqualTo(0.75);
        assertThat(report.getStatus()).isEqualTo(HealthStatus.GOOD);
        assertThat(collector.getLatestMetric(CacheStore.LAYER, MetricType.MISS_RATE).getValue())
                .isCloseTo(0.25, within(1e-9));
    }

    @Test
    void testCacheSizeAlert() {
        fill(10);

        SizeReport report = analyzer.analyzeCacheSize();

        assertThat(report.getUtilization()).isEqualTo(1.0);
        assertThat(report.getStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(report.getTotalSizeMb()).isPositive();
        assertThat(analyzer.getActiveAlerts())
                .extracting(CacheAlert::getMetricType)
                .containsExactly(MetricType.UTILIZATION);
    }

    @Test
    void testEvictionRateUsesPreviousSample() {
        EvictionReport first = analyzer.analyzeEvictions();
        assertThat(first.getEvictionRatePerMinute()).isZero();

        fill(30);
        clock.advance(Duration.ofMinutes(2));
        EvictionReport second = analyzer.analyzeEvictions();

        assertThat(second.getEvictions()).isEqualTo(20);
        assertThat(second.getEvictionRatePerMinute()).isCloseTo(10.0, within(1e-9));
        assertThat(second.getStatus()).isEqualTo(HealthStatus.OK);

        fill(30);
        clock.advance(Duration.ofMinutes(1));
        EvictionReport third = analyzer.analyzeEvictions();

        assertThat(third.getEvictionRatePerMinute()).isCloseTo(30.0, within(1e-9));
        assertThat(third.getStatus()).isEqualTo(HealthStatus.WARNING);
        assertThat(analyzer.getActiveAlerts()).hasSize(1);
    }

    @Test
    void testNoDegradationWithoutHistory() {
        assertThat(analyzer.detectPerformanceDegradation()).isNull();
        // The current sample is recorded for the next comparison
        assertThat(collector.getMetrics(CacheStore.LAYER, MetricType.HIT_RATE, null)).hasSize(1);
    }

    @Test
    void testDegradationAgainstHistoricalAverage() {
        collector.recordMetric(CacheStore.LAYER, MetricType.HIT_RATE, 0.9);
        collector.recordMetric(CacheStore.LAYER, MetricType.HIT_RATE, 0.9);
        cache.set("k", "v", null, null);
        cache.get("k");
        cache.get("missing");

        DegradationReport report = analyzer.detectPerformanceDegradation(Duration.ofMinutes(10));

        assertThat(report).isNotNull();
        assertThat(report.getCurrentHitRate()).isEqualTo(0.5);
        assertThat(report.getHistoricalAverage()).isCloseTo(0.9, within(1e-9));
        assertThat(report.getDegradationPercent()).isCloseTo(44.44, within(0.01));
        assertThat(analyzer.getActiveAlerts())
                .extracting(CacheAlert::getMetricType)
                .contains(MetricType.PERFORMANCE_DEGRADATION);
    }

    @Test
    void testAcknowledgeAlert() {
        fill(10);
        analyzer.analyzeCacheSize();
        String id = analyzer.getActiveAlerts().get(0).getId();

        assertThat(analyzer.acknowledgeAlert(id)).isTrue();
        assertThat(analyzer.acknowledgeAlert("unknown")).isFalse();
        assertThat(analyzer.getActiveAlerts()).isEmpty();
    }

    @Test
    void testAlertCallbacks() {
        List<CacheAlert> received = new ArrayList<>();
        analyzer.registerAlertCallback(alert -> {
            throw new IllegalStateException("pager down");
        });
        analyzer.registerAlertCallback(received::add);

        fill(10);
        analyzer.analyzeCacheSize();

        assertThat(received).hasSize(1);
    }

    @Test
    void testAlertHistoryIsCapped() {
        fill(10);
        for (int i = 0; i < PerformanceAnalyzer.MAX_ALERTS + 5; i++) {
            analyzer.analyzeCacheSize();
        }

        List<CacheAlert> alerts = analyzer.getActiveAlerts();
        assertThat(alerts).hasSize(PerformanceAnalyzer.MAX_ALERTS);
        assertThat(alerts.get(0).getId()).endsWith("_6");
    }

    @Test
    void testTriggerCleanupRunsEveryCallback() {
        memory.set("short", "v", Duration.ofSeconds(1), null);
        memory.set("long", "v", null, null);
        clock.advance(Duration.ofSeconds(2));

        analyzer.registerCleanupCallback(() -> {
            throw new IllegalStateException("cleanup failed");
        });
        analyzer.registerCleanupCallback(memory::purgeExpired);

        CleanupResult result = analyzer.triggerCleanup("manual");

        assertThat(result.getCallbacksExecuted()).isEqualTo(1);
        assertThat(result.getCallbacksFailed()).isEqualTo(1);
        assertThat(result.getEntriesFreed()).isEqualTo(1);
        assertThat(result.getSpaceFreedBytes()).isPositive();
        assertThat(analyzer.getLastCleanup()).isEqualTo(clock.instant());
    }

    @Test
    void testCleanupOnlyAboveThreshold() {
        fill(5);
        assertThat(analyzer.checkAndCleanupIfNeeded(0.9)).isNull();

        fill(10);
        CleanupResult result = analyzer.checkAndCleanupIfNeeded(0.9);
        assertThat(result).isNotNull();
        assertThat(result.getReason()).isEqualTo("high_utilization");
    }

    @Test
    void testComprehensiveReport() {
        fill(10);
        missTimes(100);

        PerformanceReport report = analyzer.getComprehensiveReport();

        assertThat(report.getHitRate().getTotalRequests()).isEqualTo(100);
        assertThat(report.getSize().getEntries()).isEqualTo(10);
        assertThat(report.getEvictions()).isNotNull();
        assertThat(report.getAlerts()).isNotEmpty();
        assertThat(report.getRecommendations())
                .anyMatch(text -> text.contains("hit rate"))
                .anyMatch(text -> text.contains("nearly full"));
        assertThat(report.getDetailedMetrics()).isNull();
    }

    @Test
    void testDetailedMetrics() {
        fill(5);
        analyzer.analyzeCacheSize();
        fill(10);
        analyzer.analyzeCacheSize();

        DetailedMetrics metrics = analyzer.getDetailedMetrics(Duration.ofHours(1));

        assertThat(metrics.getMetrics()).containsKey(MetricType.UTILIZATION);
        assertThat(metrics.getMetrics().get(MetricType.UTILIZATION).getCount()).isEqualTo(2);
        assertThat(metrics.getMetrics().get(MetricType.UTILIZATION).getMin()).isEqualTo(0.5);
        assertThat(metrics.getMetrics().get(MetricType.UTILIZATION).getMax()).isEqualTo(1.0);
        assertThat(metrics.getMetrics().get(MetricType.UTILIZATION).getCurrent()).isEqualTo(1.0);
    }

    private void missTimes(int count) {
        for (int i = 0; i < count; i++) {
            cache.get("absent-" + i);
        }
    }

    private void fill(int count) {
        for (int i = 0; i < count; i++) {
            cache.set("key-" + clock.instant().toEpochMilli() + "-" + i, "value-" + i, null, null);
        }
    }
}
