package net.vortexdevelopment.vcache.monitor;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.monitor.report.MonitoringStatus;
import net.vortexdevelopment.vcache.monitor.report.PerformanceReport;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Periodic cache monitoring on a daemon thread.
 * <p>
 * Each tick collects hit rate, size and eviction metrics and checks for degradation.
 * Active alerts are logged every {@value #ALERT_CHECK_EVERY} ticks, starting with the first.
 * With auto-cleanup enabled, cleanup callbacks run whenever utilization exceeds the
 * threshold; a default callback purging expired entries is registered at construction.
 */
@Slf4j
public class CacheMonitor {

    public static final int ALERT_CHECK_EVERY = 5;
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);
    public static final double DEFAULT_CLEANUP_THRESHOLD = 0.9;

    private final MultiLayerCache cache;
    private final PerformanceAnalyzer analyzer;
    private final Duration interval;
    private final Duration joinTimeout;
    private final Duration degradationWindow;
    private final Clock clock;
    private final AtomicLong collectionCount = new AtomicLong();
    private final Object stateLock = new Object();

    private volatile boolean autoCleanupEnabled;
    private volatile double cleanupThreshold;
    private volatile boolean running;
    @Nullable
    private volatile Instant lastAlertCheck;
    @Nullable
    private Thread thread;
    private CountDownLatch stopSignal = new CountDownLatch(1);
    private boolean defaultCleanupRegistered;

    @Builder
    private CacheMonitor(MultiLayerCache cache, PerformanceAnalyzer analyzer, @Nullable Duration interval,
                         @Nullable Boolean autoCleanup, @Nullable Double cleanupThreshold,
                         @Nullable Duration joinTimeout, @Nullable Duration degradationWindow,
                         @Nullable Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.interval = interval == null ? DEFAULT_INTERVAL : interval;
        this.autoCleanupEnabled = autoCleanup == null || autoCleanup;
        this.cleanupThreshold = cleanupThreshold == null ? DEFAULT_CLEANUP_THRESHOLD : cleanupThreshold;
        this.joinTimeout = joinTimeout == null ? DEFAULT_JOIN_TIMEOUT : joinTimeout;
        this.degradationWindow = degradationWindow == null ? PerformanceAnalyzer.DEFAULT_DEGRADATION_WINDOW : degradationWindow;
        this.clock = clock == null ? Clock.systemUTC() : clock;

        if (autoCleanupEnabled) {
            registerDefaultCleanup();
        }
    }

    private void registerDefaultCleanup() {
        synchronized (stateLock) {
            if (!defaultCleanupRegistered) {
                analyzer.registerCleanupCallback(this::purgeExpiredEntries);
                defaultCleanupRegistered = true;
            }
        }
    }

    public void start() {
        synchronized (stateLock) {
            if (running) {
                return;
            }
            running = true;
            stopSignal = new CountDownLatch(1);
            CountDownLatch signal = stopSignal;
            thread = new Thread(() -> monitoringLoop(signal), "vcache-monitor");
            thread.setDaemon(true);
            thread.start();
        }
        log.info("Cache monitoring started intervalSeconds={} autoCleanup={}", interval.getSeconds(), autoCleanupEnabled);
    }

    /**
     * Signal the loop to stop and wait up to the join timeout for it to finish.
     */
    public void stop() {
        Thread toJoin;
        synchronized (stateLock) {
            if (!running) {
                return;
            }
            running = false;
            stopSignal.countDown();
            toJoin = thread;
            thread = null;
        }
        if (toJoin != null) {
            try {
                toJoin.join(joinTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (toJoin.isAlive()) {
                log.warn("Cache monitor thread did not stop within timeout timeoutMs={}", joinTimeout.toMillis());
            }
        }
        log.info("Cache monitoring stopped");
    }

    private void monitoringLoop(CountDownLatch signal) {
        while (running) {
            try {
                runCycle();
            } catch (RuntimeException e) {
                log.error("Cache monitoring error error={}", e.getMessage(), e);
            }
            try {
                if (signal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Run one monitoring tick on the calling thread.
     */
    public void runCycle() {
        long count = collectionCount.get();
        collectMetrics();
        if (count % ALERT_CHECK_EVERY == 0) {
            checkAlerts();
        }
        if (autoCleanupEnabled) {
            analyzer.checkAndCleanupIfNeeded(cleanupThreshold);
        }
        collectionCount.incrementAndGet();
    }

    private void collectMetrics() {
        try {
            // Runs the tick's hit rate analysis after reading the rolling average
            analyzer.detectPerformanceDegradation(degradationWindow);
            analyzer.analyzeCacheSize();
            analyzer.analyzeEvictions();
            log.debug("Cache metrics collected collectionCount={}", collectionCount.get());
        } catch (RuntimeException e) {
            log.error("Failed to collect cache metrics error={}", e.getMessage(), e);
        }
    }

    private void checkAlerts() {
        lastAlertCheck = clock.instant();
        List<CacheAlert> alerts = analyzer.getActiveAlerts();
        if (!alerts.isEmpty()) {
            log.warn("Active cache performance alerts count={} alerts={}", alerts.size(),
                    alerts.stream().map(CacheAlert::getMessage).collect(Collectors.toList()));
        }
    }

    private void purgeExpiredEntries() {
        int purged = cache.getMemoryStore().purgeExpired();
        if (purged > 0) {
            log.info("Default cleanup completed expiredEntries={}", purged);
        }
    }

    public PerformanceReport getReport() {
        return analyzer.getComprehensiveReport();
    }

    public PerformanceReport getDetailedReport(Duration window) {
        return getReport().toBuilder()
                .detailedMetrics(analyzer.getDetailedMetrics(window))
                .monitoringStatus(getStatus())
                .build();
    }

    public MonitoringStatus getStatus() {
        return MonitoringStatus.builder()
                .running(running)
                .collectionInterval(interval)
                .collectionCount(collectionCount.get())
                .autoCleanupEnabled(autoCleanupEnabled)
                .cleanupThreshold(cleanupThreshold)
                .lastAlertCheck(lastAlertCheck)
                .build();
    }

    public void enableAutomaticCleanup(double threshold) {
        registerDefaultCleanup();
        this.cleanupThreshold = threshold;
        this.autoCleanupEnabled = true;
        log.info("Automatic cleanup enabled threshold={}", threshold);
    }

    public void disableAutomaticCleanup() {
        this.autoCleanupEnabled = false;
        log.info("Automatic cleanup disabled");
    }

    public boolean isRunning() {
        return running;
    }

    public long getCollectionCount() {
        return collectionCount.get();
    }

    public PerformanceAnalyzer getAnalyzer() {
        return analyzer;
    }
}
