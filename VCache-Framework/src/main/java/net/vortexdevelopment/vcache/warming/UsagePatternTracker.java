package net.vortexdevelopment.vcache.warming;

import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records cache key accesses for usage based warming.
 * <p>
 * The history is capped; when the oldest access is dropped its key's count is decremented,
 * so counts always describe the retained history.
 */
public class UsagePatternTracker {

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final int historySize;
    private final Clock clock;
    private final Deque<Access> accessLog = new ArrayDeque<>();
    private final Map<String, Integer> accessCounts = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public UsagePatternTracker() {
        this(DEFAULT_HISTORY_SIZE, Clock.systemUTC());
    }

    public UsagePatternTracker(int historySize, Clock clock) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive: " + historySize);
        }
        this.historySize = historySize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void recordAccess(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            accessLog.addLast(new Access(key, now));
            accessCounts.merge(key, 1, Integer::sum);
            while (accessLog.size() > historySize) {
                Access dropped = accessLog.removeFirst();
                accessCounts.computeIfPresent(dropped.key, (k, count) -> count > 1 ? count - 1 : null);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the most accessed keys, highest count first
     */
    public List<KeyFrequency> getHotKeys(int topN) {
        lock.lock();
        try {
            List<KeyFrequency> frequencies = new ArrayList<>(accessCounts.size());
            accessCounts.forEach((key, count) -> frequencies.add(new KeyFrequency(key, count)));
            frequencies.sort(Comparator.comparingInt(KeyFrequency::getAccessCount).reversed()
                    .thenComparing(KeyFrequency::getKey));
            return frequencies.size() > topN ? new ArrayList<>(frequencies.subList(0, topN)) : frequencies;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return accesses per minute over the trailing window
     */
    public double getAccessFrequency(String key, Duration window) {
        double minutes = window.toMillis() / 60_000.0;
        if (minutes <= 0) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(window);
        lock.lock();
        try {
            int count = 0;
            for (Access access : accessLog) {
                if (access.key.equals(key) && !access.time.isBefore(cutoff)) {
                    count++;
                }
            }
            return count / minutes;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last access plus the mean interval between retained accesses of the key.
     *
     * @return the predicted time, or null with fewer than two accesses
     */
    @Nullable
    public Instant predictNextAccess(String key) {
        lock.lock();
        try {
            Instant first = null;
            Instant last = null;
            int count = 0;
            for (Access access : accessLog) {
                if (access.key.equals(key)) {
                    if (first == null) {
                        first = access.time;
                    }
                    last = access.time;
                    count++;
                }
            }
            if (count < 2) {
                return null;
            }
            // Sum of consecutive intervals telescopes to last - first
            long avgIntervalMs = Duration.between(first, last).toMillis() / (count - 1);
            return last.plusMillis(avgIntervalMs);
        } finally {
            lock.unlock();
        }
    }

    public int getAccessCount(String key) {
        lock.lock();
        try {
            return accessCounts.getOrDefault(key, 0);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return accessLog.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            accessLog.clear();
            accessCounts.clear();
        } finally {
            lock.unlock();
        }
    }

    private static final class Access {
        private final String key;
        private final Instant time;

        private Access(String key, Instant time) {
            this.key = key;
            this.time = time;
        }
    }
}
