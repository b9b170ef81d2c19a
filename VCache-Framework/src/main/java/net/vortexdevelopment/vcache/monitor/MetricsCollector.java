package net.vortexdevelopment.vcache.monitor;

import net.vortexdevelopment.vcache.debug.DebugLogger;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded history of metric samples. When full, the oldest sample is dropped.
 */
public class MetricsCollector {

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private static final double TREND_THRESHOLD = 0.05;

    private final int historySize;
    private final Clock clock;
    private final Deque<CacheMetric> metrics = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public MetricsCollector() {
        this(DEFAULT_HISTORY_SIZE, Clock.systemUTC());
    }

    public MetricsCollector(int historySize, Clock clock) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive: " + historySize);
        }
        this.historySize = historySize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void recordMetric(String layer, MetricType type, double value) {
        recordMetric(layer, type, value, Map.of());
    }

    public void recordMetric(String layer, MetricType type, double value, @Nullable Map<String, Object> metadata) {
        CacheMetric metric = new CacheMetric(clock.instant(), layer, type, value,
                metadata == null ? Map.of() : Map.copyOf(metadata));
        lock.lock();
        try {
            metrics.addLast(metric);
            while (metrics.size() > historySize) {
                metrics.removeFirst();
            }
        } finally {
            lock.unlock();
        }
        DebugLogger.log("Recorded %s=%s for layer %s", type.id(), value, layer);
    }

    /**
     * Query samples, oldest first. Null arguments do not filter.
     */
    public List<CacheMetric> getMetrics(@Nullable String layer, @Nullable MetricType type, @Nullable Instant since) {
        List<CacheMetric> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(metrics);
        } finally {
            lock.unlock();
        }
        List<CacheMetric> result = new ArrayList<>();
        for (CacheMetric metric : snapshot) {
            if (layer != null && !layer.equals(metric.getLayer())) {
                continue;
            }
            if (type != null && type != metric.getType()) {
                continue;
            }
            if (since != null && metric.getTimestamp().isBefore(since)) {
                continue;
            }
            result.add(metric);
        }
        return result;
    }

    @Nullable
    public CacheMetric getLatestMetric(String layer, MetricType type) {
        List<CacheMetric> matching = getMetrics(layer, type, null);
        return matching.isEmpty() ? null : matching.get(matching.size() - 1);
    }

    /**
     * @return mean value over the trailing window, or null without samples
     */
    @Nullable
    public Double calculateAverage(String layer, MetricType type, Duration window) {
        List<CacheMetric> matching = getMetrics(layer, type, clock.instant().minus(window));
        if (matching.isEmpty()) {
            return null;
        }
        return mean(matching);
    }

    /**
     * Compare the mean of the older half of the window with the newer half. A change of
     * more than 5% in the better direction is an improvement.
     *
     * @return the trend, or null with fewer than two samples
     */
    @Nullable
    public Trend calculateTrend(String layer, MetricType type, Duration window) {
        List<CacheMetric> matching = getMetrics(layer, type, clock.instant().minus(window));
        if (matching.size() < 2) {
            return null;
        }
        int mid = matching.size() / 2;
        double avgFirst = mean(matching.subList(0, mid));
        double avgSecond = mean(matching.subList(mid, matching.size()));

        boolean rose = avgSecond > avgFirst * (1 + TREND_THRESHOLD);
        boolean fell = avgSecond < avgFirst * (1 - TREND_THRESHOLD);
        if (type.isHigherBetter()) {
            if (rose) {
                return Trend.IMPROVING;
            }
            if (fell) {
                return Trend.DEGRADING;
            }
        } else {
            if (fell) {
                return Trend.IMPROVING;
            }
            if (rose) {
                return Trend.DEGRADING;
            }
        }
        return Trend.STABLE;
    }

    public void clear() {
        lock.lock();
        try {
            metrics.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return metrics.size();
        } finally {
            lock.unlock();
        }
    }

    public int getHistorySize() {
        return historySize;
    }

    private static double mean(List<CacheMetric> samples) {
        double sum = 0;
        for (CacheMetric sample : samples) {
            sum += sample.getValue();
        }
        return sum / samples.size();
    }
}
