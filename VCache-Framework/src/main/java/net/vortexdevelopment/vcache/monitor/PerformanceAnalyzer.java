package net.vortexdevelopment.vcache.monitor;

import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.CacheStats;
import net.vortexdevelopment.vcache.cache.CacheStore;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.monitor.report.CleanupResult;
import net.vortexdevelopment.vcache.monitor.report.DegradationReport;
import net.vortexdevelopment.vcache.monitor.report.DetailedMetrics;
import net.vortexdevelopment.vcache.monitor.report.EvictionReport;
import net.vortexdevelopment.vcache.monitor.report.HitRateReport;
import net.vortexdevelopment.vcache.monitor.report.MetricSummary;
import net.vortexdevelopment.vcache.monitor.report.PerformanceReport;
import net.vortexdevelopment.vcache.monitor.report.SizeReport;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pull-based analysis of the memory layer. Every analysis records its samples into the
 * {@link MetricsCollector} and raises alerts when a threshold is crossed.
 */
@Slf4j
public class PerformanceAnalyzer {

    public static final Duration TREND_WINDOW = Duration.ofMinutes(5);
    public static final Duration DEFAULT_DEGRADATION_WINDOW = Duration.ofMinutes(10);
    public static final int MAX_ALERTS = 1000;

    private static final String LAYER = CacheStore.LAYER;

    private final MultiLayerCache cache;
    private final MetricsCollector metricsCollector;
    private final AlertThresholds thresholds;
    private final Clock clock;

    private final List<CacheAlert> alerts = new ArrayList<>();
    private final List<CleanupCallback> cleanupCallbacks = new CopyOnWriteArrayList<>();
    private final List<AlertCallback> alertCallbacks = new CopyOnWriteArrayList<>();
    private final AtomicLong alertSequence = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();

    @Nullable
    private Instant lastCleanup;
    private long previousEvictions = -1;
    @Nullable
    private Instant previousEvictionSample;

    public PerformanceAnalyzer(MultiLayerCache cache, MetricsCollector metricsCollector) {
        this(cache, metricsCollector, AlertThresholds.defaults(), Clock.systemUTC());
    }

    public PerformanceAnalyzer(MultiLayerCache cache, MetricsCollector metricsCollector,
                               AlertThresholds thresholds, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HitRateReport analyzeHitRate() {
        CacheStats stats = cache.getStats();
        double hitRate = stats.getHitRate();
        long total = stats.getTotalRequests();

        metricsCollector.recordMetric(LAYER, MetricType.HIT_RATE, hitRate);
        if (total > 0) {
            metricsCollector.recordMetric(LAYER, MetricType.MISS_RATE, 1 - hitRate);
        }

        if (hitRate < thresholds.getHitRateLow() && total >= thresholds.getMinRequestsForHitRateAlert()) {
            createAlert(AlertSeverity.WARNING, String.format("Low cache hit rate: %.1f%%", hitRate * 100),
                    MetricType.HIT_RATE, thresholds.getHitRateLow(), hitRate);
        }

        return HitRateReport.builder()
                .layer(LAYER)
                .hitRate(hitRate)
                .hits(stats.getHits())
                .misses(stats.getMisses())
                .totalRequests(total)
                .trend(metricsCollector.calculateTrend(LAYER, MetricType.HIT_RATE, TREND_WINDOW))
                .status(HealthStatus.forHitRate(hitRate))
                .build();
    }

    public SizeReport analyzeCacheSize() {
        CacheStats stats = cache.getStats();
        double utilization = stats.getUtilization();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entries", stats.getEntries());
        metadata.put("sizeBytes", stats.getTotalSizeBytes());
        metricsCollector.recordMetric(LAYER, MetricType.UTILIZATION, utilization, metadata);

        if (utilization > thresholds.getUtilizationHigh()) {
            createAlert(AlertSeverity.WARNING, String.format("Cache nearly full: %.1f%%", utilization * 100),
                    MetricType.UTILIZATION, thresholds.getUtilizationHigh(), utilization);
        }

        return SizeReport.builder()
                .layer(LAYER)
                .entries(stats.getEntries())
                .maxEntries(stats.getMaxEntries())
                .utilization(utilization)
                .totalSizeBytes(stats.getTotalSizeBytes())
                .status(HealthStatus.forUtilization(utilization))
                .build();
    }

    /**
     * Eviction counters plus the eviction rate per minute since the previous call.
     */
    public EvictionReport analyzeEvictions() {
        CacheStats stats = cache.getStats();
        long evictions = stats.getEvictions();
        Instant now = clock.instant();

        double ratePerMinute = 0;
        lock.lock();
        try {
            if (previousEvictionSample != null && previousEvictions >= 0) {
                long elapsedMs = Duration.between(previousEvictionSample, now).toMillis();
                if (elapsedMs > 0) {
                    ratePerMinute = Math.max(0, evictions - previousEvictions) * 60_000.0 / elapsedMs;
                }
            }
            previousEvictions = evictions;
            previousEvictionSample = now;
        } finally {
            lock.unlock();
        }

        metricsCollector.recordMetric(LAYER, MetricType.EVICTIONS, evictions,
                Map.of("expirations", stats.getExpirations()));
        metricsCollector.recordMetric(LAYER, MetricType.EVICTION_RATE, ratePerMinute);

        boolean high = ratePerMinute > thresholds.getEvictionRateHigh();
        if (high) {
            createAlert(AlertSeverity.WARNING, String.format("High eviction rate: %.1f/min", ratePerMinute),
                    MetricType.EVICTION_RATE, thresholds.getEvictionRateHigh(), ratePerMinute);
        }

        return EvictionReport.builder()
                .layer(LAYER)
                .evictions(evictions)
                .expirations(stats.getExpirations())
                .evictionRatePerMinute(ratePerMinute)
                .status(high ? HealthStatus.WARNING : HealthStatus.OK)
                .build();
    }

    /**
     * Compare the current hit rate with the average of the samples recorded during the
     * window, before the current one is added. Runs {@link #analyzeHitRate()} once, which
     * records the current sample and raises any low hit rate alert.
     *
     * @return details when the drop exceeds the degradation threshold, otherwise null
     */
    @Nullable
    public DegradationReport detectPerformanceDegradation(Duration window) {
        Double historicalAverage = metricsCollector.calculateAverage(LAYER, MetricType.HIT_RATE, window);
        double currentHitRate = analyzeHitRate().getHitRate();

        if (historicalAverage == null || historicalAverage == 0) {
            return null;
        }

        double degradation = (historicalAverage - currentHitRate) / historicalAverage;
        double threshold = thresholds.getDegradationThreshold();
        if (degradation <= threshold) {
            return null;
        }

        DegradationReport report = DegradationReport.builder()
                .layer(LAYER)
                .currentHitRate(currentHitRate)
                .historicalAverage(historicalAverage)
                .degradationPercent(degradation * 100)
                .thresholdPercent(threshold * 100)
                .window(window)
                .detectedAt(clock.instant())
                .build();

        createAlert(AlertSeverity.WARNING,
                String.format("Performance degradation detected: %.1f%% drop in hit rate", degradation * 100),
                MetricType.PERFORMANCE_DEGRADATION, threshold, degradation);
        log.warn("Cache performance degradation detected layer={} currentHitRate={} historicalAverage={} degradationPercent={}",
                LAYER, currentHitRate, historicalAverage, report.getDegradationPercent());
        return report;
    }

    @Nullable
    public DegradationReport detectPerformanceDegradation() {
        return detectPerformanceDegradation(DEFAULT_DEGRADATION_WINDOW);
    }

    public DetailedMetrics getDetailedMetrics(Duration window) {
        List<CacheMetric> samples = metricsCollector.getMetrics(LAYER, null, clock.instant().minus(window));

        Map<MetricType, List<Double>> byType = new EnumMap<>(MetricType.class);
        for (CacheMetric sample : samples) {
            byType.computeIfAbsent(sample.getType(), k -> new ArrayList<>()).add(sample.getValue());
        }

        Map<MetricType, MetricSummary> summaries = new EnumMap<>(MetricType.class);
        for (Map.Entry<MetricType, List<Double>> entry : byType.entrySet()) {
            List<Double> values = entry.getValue();
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            double sum = 0;
            for (double value : values) {
                min = Math.min(min, value);
                max = Math.max(max, value);
                sum += value;
            }
            summaries.put(entry.getKey(), MetricSummary.builder()
                    .current(values.get(values.size() - 1))
                    .average(sum / values.size())
                    .min(min)
                    .max(max)
                    .count(values.size())
                    .trend(metricsCollector.calculateTrend(LAYER, entry.getKey(), window))
                    .build());
        }

        return DetailedMetrics.builder()
                .layer(LAYER)
                .window(window)
                .metrics(summaries)
                .build();
    }

    public PerformanceReport getComprehensiveReport() {
        HitRateReport hitRate = analyzeHitRate();
        SizeReport size = analyzeCacheSize();
        EvictionReport evictions = analyzeEvictions();

        return PerformanceReport.builder()
                .timestamp(clock.instant())
                .hitRate(hitRate)
                .size(size)
                .evictions(evictions)
                .alerts(getActiveAlerts())
                .recommendations(generateRecommendations(hitRate, size))
                .build();
    }

    private List<String> generateRecommendations(HitRateReport hitRate, SizeReport size) {
        List<String> recommendations = new ArrayList<>();
        if (hitRate.getHitRate() < thresholds.getHitRateLow()) {
            recommendations.add("Consider increasing cache TTL or max entries to improve hit rate");
        }
        if (size.getUtilization() > thresholds.getUtilizationHigh()) {
            recommendations.add("Cache is nearly full. Consider increasing max entries or evicting more aggressively");
        }
        if (hitRate.getTrend() == Trend.DEGRADING) {
            recommendations.add("Cache hit rate is degrading. Review cache invalidation patterns");
        }
        DegradationReport degradation = detectPerformanceDegradation();
        if (degradation != null) {
            recommendations.add(String.format("Performance degraded by %.1f%%. Investigate recent changes or increased load",
                    degradation.getDegradationPercent()));
        }
        if (size.getUtilization() > 0.85) {
            recommendations.add("Cache utilization is high. Consider enabling automatic cleanup or increasing cache size");
        }
        return recommendations;
    }

    private void createAlert(AlertSeverity severity, String message, MetricType metricType,
                             double threshold, double actualValue) {
        Instant now = clock.instant();
        CacheAlert alert = new CacheAlert(
                metricType.id() + "_" + now.getEpochSecond() + "_" + alertSequence.incrementAndGet(),
                severity, message, metricType, threshold, actualValue, now);

        lock.lock();
        try {
            alerts.add(alert);
            if (alerts.size() > MAX_ALERTS) {
                alerts.remove(0);
            }
        } finally {
            lock.unlock();
        }

        log.warn("Cache performance alert severity={} message=\"{}\" metricType={}",
                severity, message, metricType.id());

        for (AlertCallback callback : alertCallbacks) {
            try {
                callback.onAlert(alert);
            } catch (Exception e) {
                log.error("Alert callback failed alertId={} error={}", alert.getId(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return unacknowledged alerts, oldest first
     */
    public List<CacheAlert> getActiveAlerts() {
        lock.lock();
        try {
            List<CacheAlert> active = new ArrayList<>();
            for (CacheAlert alert : alerts) {
                if (!alert.isAcknowledged()) {
                    active.add(alert);
                }
            }
            return active;
        } finally {
            lock.unlock();
        }
    }

    public boolean acknowledgeAlert(String alertId) {
        lock.lock();
        try {
            for (CacheAlert alert : alerts) {
                if (alert.getId().equals(alertId)) {
                    alert.acknowledge();
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public void registerAlertCallback(AlertCallback callback) {
        alertCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public void registerCleanupCallback(CleanupCallback callback) {
        cleanupCallbacks.add(Objects.requireNonNull(callback, "callback"));
        log.info("Cleanup callback registered callbacks={}", cleanupCallbacks.size());
    }

    /**
     * Run every cleanup callback. A failing callback is logged and the rest still run.
     */
    public CleanupResult triggerCleanup(String reason) {
        Instant now = clock.instant();
        lock.lock();
        try {
            lastCleanup = now;
        } finally {
            lock.unlock();
        }
        log.info("Cache cleanup triggered reason={}", reason);

        CacheStats before = cache.getStats();
        int executed = 0;
        int failed = 0;
        for (CleanupCallback callback : cleanupCallbacks) {
            try {
                callback.cleanup();
                executed++;
            } catch (Exception e) {
                failed++;
                log.error("Cleanup callback failed reason={} error={}", reason, e.getMessage(), e);
            }
        }
        CacheStats after = cache.getStats();

        CleanupResult result = CleanupResult.builder()
                .timestamp(now)
                .reason(reason)
                .callbacksExecuted(executed)
                .callbacksFailed(failed)
                .entriesBefore(before.getEntries())
                .entriesAfter(after.getEntries())
                .spaceFreedBytes(before.getTotalSizeBytes() - after.getTotalSizeBytes())
                .build();
        log.info("Cache cleanup completed reason={} entriesFreed={} spaceFreedBytes={}",
                reason, result.getEntriesFreed(), result.getSpaceFreedBytes());
        return result;
    }

    /**
     * @return the cleanup result if utilization exceeded the threshold, otherwise null
     */
    @Nullable
    public CleanupResult checkAndCleanupIfNeeded(double utilizationThreshold) {
        if (cache.getStats().getUtilization() > utilizationThreshold) {
            return triggerCleanup("high_utilization");
        }
        return null;
    }

    @Nullable
    public Instant getLastCleanup() {
        lock.lock();
        try {
            return lastCleanup;
        } finally {
            lock.unlock();
        }
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public AlertThresholds getThresholds() {
        return thresholds;
    }
}
