package net.vortexdevelopment.vcache.warming;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.CacheKeys;
import net.vortexdevelopment.vcache.cache.ComputeFunction;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.warming.report.ScheduleAdjustment;
import net.vortexdevelopment.vcache.warming.report.TaskDetails;
import net.vortexdevelopment.vcache.warming.report.TaskOutcome;
import net.vortexdevelopment.vcache.warming.report.UserWarmingReport;
import net.vortexdevelopment.vcache.warming.report.WarmingPerformance;
import net.vortexdevelopment.vcache.warming.report.WarmingReport;
import net.vortexdevelopment.vcache.warming.report.WarmingStats;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Proactive cache population.
 * <p>
 * Critical tasks are re-warmed on their own schedule, hot keys reported by the
 * {@link UsagePatternTracker} are re-warmed when a task is registered for them, and
 * per-user data is preloaded on demand with a cool-down. A background loop can run
 * critical and pattern warming at a fixed interval.
 */
@Slf4j
public class WarmingEngine {

    public static final int DEFAULT_CRITICAL_PRIORITY = 50;
    public static final Duration DEFAULT_TASK_INTERVAL = Duration.ofMinutes(60);
    public static final Duration DEFAULT_USER_COOLDOWN = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_USER_SUB_RESOURCES = 5;
    public static final Duration FREQUENCY_WINDOW = Duration.ofMinutes(60);
    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final MultiLayerCache cache;
    private final UsagePatternTracker usageTracker;
    private final UserDataLoader userDataLoader;
    private final Clock clock;
    private final int criticalPriority;
    private final Duration taskInterval;
    private final Duration userCooldown;
    private final int maxUserSubResources;
    private final Duration joinTimeout;

    private final Map<String, WarmingTask> tasks = new LinkedHashMap<>();
    private final Set<String> criticalKeys = new HashSet<>();
    private final Map<String, Instant> userPreloads = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long totalWarmings;
    private double totalDurationMs;
    private double fastestMs = Double.MAX_VALUE;
    private double slowestMs;

    private volatile boolean running;
    @Nullable
    private Thread thread;
    private CountDownLatch stopSignal = new CountDownLatch(1);

    @Builder
    private WarmingEngine(MultiLayerCache cache, @Nullable UsagePatternTracker usageTracker,
                          @Nullable UserDataLoader userDataLoader, @Nullable Clock clock,
                          @Nullable Integer criticalPriority, @Nullable Duration taskInterval,
                          @Nullable Duration userCooldown, @Nullable Integer maxUserSubResources,
                          @Nullable Duration joinTimeout) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.usageTracker = usageTracker == null ? new UsagePatternTracker(UsagePatternTracker.DEFAULT_HISTORY_SIZE, this.clock) : usageTracker;
        this.userDataLoader = userDataLoader == null ? new DefaultUserDataLoader() : userDataLoader;
        this.criticalPriority = criticalPriority == null ? DEFAULT_CRITICAL_PRIORITY : criticalPriority;
        this.taskInterval = taskInterval == null ? DEFAULT_TASK_INTERVAL : taskInterval;
        this.userCooldown = userCooldown == null ? DEFAULT_USER_COOLDOWN : userCooldown;
        this.maxUserSubResources = maxUserSubResources == null ? DEFAULT_MAX_USER_SUB_RESOURCES : maxUserSubResources;
        this.joinTimeout = joinTimeout == null ? DEFAULT_JOIN_TIMEOUT : joinTimeout;
    }

    public void registerTask(WarmingTask task) {
        registerTask(task, false);
    }

    /**
     * @param critical always include the task in critical warming, whatever its priority
     */
    public void registerTask(WarmingTask task, boolean critical) {
        Objects.requireNonNull(task, "task");
        lock.lock();
        try {
            tasks.put(task.getTaskId(), task);
            if (critical) {
                criticalKeys.add(task.getCacheKey());
            }
        } finally {
            lock.unlock();
        }
        log.info("Cache warming task registered taskId={} name={} priority={} critical={}",
                task.getTaskId(), task.getName(), task.getPriority(), critical);
    }

    public boolean unregisterTask(String taskId) {
        lock.lock();
        try {
            WarmingTask removed = tasks.remove(taskId);
            if (removed == null) {
                return false;
            }
            boolean keyStillUsed = tasks.values().stream()
                    .anyMatch(task -> task.getCacheKey().equals(removed.getCacheKey()));
            if (!keyStillUsed) {
                criticalKeys.remove(removed.getCacheKey());
            }
        } finally {
            lock.unlock();
        }
        log.info("Cache warming task unregistered taskId={}", taskId);
        return true;
    }

    @Nullable
    public WarmingTask getTask(String taskId) {
        lock.lock();
        try {
            return tasks.get(taskId);
        } finally {
            lock.unlock();
        }
    }

    public void setTaskEnabled(String taskId, boolean enabled) {
        lock.lock();
        try {
            WarmingTask task = tasks.get(taskId);
            if (task != null) {
                task.setEnabled(enabled);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Populate one key through {@link MultiLayerCache#getOrCompute}.
     *
     * @return false if the computation failed
     */
    public boolean warmKey(String key, ComputeFunction<?> computeFn, @Nullable Duration ttl,
                           @Nullable Set<String> tags, boolean force) {
        long start = System.nanoTime();
        try {
            cache.getOrCompute(key, computeFn, ttl, tags, force);
        } catch (RuntimeException e) {
            log.error("Cache warming failed key={} error={}", key, e.getMessage(), e);
            return false;
        }
        double durationMs = (System.nanoTime() - start) / 1_000_000.0;

        lock.lock();
        try {
            totalWarmings++;
            totalDurationMs += durationMs;
            fastestMs = Math.min(fastestMs, durationMs);
            slowestMs = Math.max(slowestMs, durationMs);
        } finally {
            lock.unlock();
        }
        log.info("Cache key warmed key={} durationMs={} forced={}", key, (long) durationMs, force);
        return true;
    }

    /**
     * Warm tasks marked critical or at or above the critical priority, highest priority
     * first. Disabled tasks and tasks not yet due are skipped. Values are always recomputed.
     */
    public WarmingReport warmCriticalData() {
        long start = System.nanoTime();
        List<WarmingTask> selected = new ArrayList<>();
        lock.lock();
        try {
            for (WarmingTask task : tasks.values()) {
                if (criticalKeys.contains(task.getCacheKey()) || task.getPriority() >= criticalPriority) {
                    selected.add(task);
                }
            }
        } finally {
            lock.unlock();
        }
        selected.sort(Comparator.comparingInt(WarmingTask::getPriority).reversed());

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        List<TaskOutcome> outcomes = new ArrayList<>();
        for (WarmingTask task : selected) {
            if (!isDue(task)) {
                skipped++;
                continue;
            }

            long taskStart = System.nanoTime();
            boolean success = warmKey(task.getCacheKey(), task.getComputeFn(), task.getTtl(), task.getTags(), true);
            double durationMs = (System.nanoTime() - taskStart) / 1_000_000.0;

            lock.lock();
            try {
                Instant now = clock.instant();
                task.recordRun(durationMs, now);
                task.reschedule(now, task.getInterval() == null ? taskInterval : task.getInterval());
            } finally {
                lock.unlock();
            }

            if (success) {
                succeeded++;
            } else {
                failed++;
            }
            outcomes.add(TaskOutcome.builder()
                    .key(task.getCacheKey())
                    .taskId(task.getTaskId())
                    .name(task.getName())
                    .success(success)
                    .durationMs((long) durationMs)
                    .build());
        }

        WarmingReport report = WarmingReport.builder()
                .total(selected.size())
                .succeeded(succeeded)
                .failed(failed)
                .skipped(skipped)
                .outcomes(outcomes)
                .durationMs(elapsedMs(start))
                .build();
        log.info("Critical data warming completed total={} succeeded={} failed={} skipped={} durationMs={}",
                report.getTotal(), succeeded, failed, skipped, report.getDurationMs());
        return report;
    }

    private boolean isDue(WarmingTask task) {
        lock.lock();
        try {
            return task.shouldRun(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public UserWarmingReport warmUserData(String userId) {
        return warmUserData(userId, false, true);
    }

    /**
     * Warm the session and navigation entries of a user and, optionally, the user's most
     * recent sub-resources. A user warmed within the cool-down is skipped unless forced.
     */
    public UserWarmingReport warmUserData(String userId, boolean force, boolean preloadSubResources) {
        Instant now = clock.instant();
        lock.lock();
        try {
            Instant lastPreload = userPreloads.get(userId);
            if (!force && lastPreload != null && now.isBefore(lastPreload.plus(userCooldown))) {
                log.debug("User data recently warmed, skipping userId={} secondsAgo={}",
                        userId, Duration.between(lastPreload, now).getSeconds());
                return UserWarmingReport.skipped(userId, "recently_warmed");
            }
        } finally {
            lock.unlock();
        }

        long start = System.nanoTime();
        Map<String, ComputeFunction<?>> keysToWarm = new LinkedHashMap<>();
        keysToWarm.put(CacheKeys.userSession(userId), () -> userDataLoader.loadSession(userId));
        keysToWarm.put(CacheKeys.navigation(userId), () -> userDataLoader.loadNavigation(userId));

        if (preloadSubResources) {
            for (String resourceId : recentSubResources(userId)) {
                keysToWarm.put(CacheKeys.formData(resourceId, userId),
                        () -> userDataLoader.loadSubResource(userId, resourceId));
            }
        }

        Set<String> tags = Set.of("user", "user:" + userId);
        List<String> warmed = new ArrayList<>();
        int failed = 0;
        for (Map.Entry<String, ComputeFunction<?>> entry : keysToWarm.entrySet()) {
            if (warmKey(entry.getKey(), entry.getValue(), null, tags, false)) {
                warmed.add(entry.getKey());
            } else {
                failed++;
            }
        }

        lock.lock();
        try {
            Instant warmedAt = clock.instant();
            userPreloads.values().removeIf(last -> !warmedAt.isBefore(last.plus(userCooldown)));
            userPreloads.put(userId, warmedAt);
        } finally {
            lock.unlock();
        }

        UserWarmingReport report = UserWarmingReport.builder()
                .userId(userId)
                .skipped(false)
                .keysWarmed(warmed)
                .succeeded(warmed.size())
                .failed(failed)
                .durationMs(elapsedMs(start))
                .build();
        log.info("User data warmed userId={} succeeded={} failed={} durationMs={}",
                userId, report.getSucceeded(), failed, report.getDurationMs());
        return report;
    }

    private List<String> recentSubResources(String userId) {
        try {
            List<String> recent = userDataLoader.recentSubResources(userId);
            return recent.size() > maxUserSubResources ? recent.subList(0, maxUserSubResources) : recent;
        } catch (Exception e) {
            log.warn("Loading recent sub-resources failed userId={} error={}", userId, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Re-warm the hottest keys that have a registered task and are accessed at least
     * {@code minFrequency} times per minute.
     */
    public WarmingReport warmByUsagePatterns(int topN, double minFrequency) {
        long start = System.nanoTime();
        int total = 0;
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        List<TaskOutcome> outcomes = new ArrayList<>();

        for (KeyFrequency hot : usageTracker.getHotKeys(topN)) {
            double frequency = usageTracker.getAccessFrequency(hot.getKey(), FREQUENCY_WINDOW);
            if (frequency < minFrequency) {
                skipped++;
                log.debug("Skipping low-frequency key key={} frequency={}", hot.getKey(), frequency);
                continue;
            }
            total++;

            WarmingTask task = findTaskByKey(hot.getKey());
            if (task == null) {
                continue;
            }
            long taskStart = System.nanoTime();
            boolean success = warmKey(task.getCacheKey(), task.getComputeFn(), task.getTtl(), task.getTags(), false);
            if (success) {
                succeeded++;
            } else {
                failed++;
            }
            outcomes.add(TaskOutcome.builder()
                    .key(hot.getKey())
                    .taskId(task.getTaskId())
                    .name(task.getName())
                    .success(success)
                    .durationMs(elapsedMs(taskStart))
                    .accessCount(hot.getAccessCount())
                    .frequency(frequency)
                    .build());
        }

        WarmingReport report = WarmingReport.builder()
                .total(total)
                .succeeded(succeeded)
                .failed(failed)
                .skipped(skipped)
                .outcomes(outcomes)
                .durationMs(elapsedMs(start))
                .build();
        log.info("Pattern-based warming completed total={} succeeded={} durationMs={}",
                total, succeeded, report.getDurationMs());
        return report;
    }

    @Nullable
    private WarmingTask findTaskByKey(String key) {
        lock.lock();
        try {
            for (WarmingTask task : tasks.values()) {
                if (task.getCacheKey().equals(key)) {
                    return task;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start the background loop. Each cycle runs critical warming and then usage pattern
     * warming (top 10 keys, at least 0.1 accesses per minute), as enabled.
     */
    public void startBackgroundWarming(Duration interval, boolean patternWarming, boolean criticalWarming) {
        lock.lock();
        try {
            if (running) {
                log.warn("Background warming already running");
                return;
            }
            running = true;
            stopSignal = new CountDownLatch(1);
            CountDownLatch signal = stopSignal;
            thread = new Thread(() -> warmingLoop(interval, patternWarming, criticalWarming, signal),
                    "vcache-warming");
            thread.setDaemon(true);
            thread.start();
        } finally {
            lock.unlock();
        }
        log.info("Background cache warming started intervalSeconds={} patternWarming={} criticalWarming={}",
                interval.getSeconds(), patternWarming, criticalWarming);
    }

    public void stopBackgroundWarming() {
        Thread toJoin;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            stopSignal.countDown();
            toJoin = thread;
            thread = null;
        } finally {
            lock.unlock();
        }
        if (toJoin != null) {
            try {
                toJoin.join(joinTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (toJoin.isAlive()) {
                log.warn("Warming thread did not stop within timeout timeoutMs={}", joinTimeout.toMillis());
            }
        }
        log.info("Background cache warming stopped");
    }

    private void warmingLoop(Duration interval, boolean patternWarming, boolean criticalWarming,
                             CountDownLatch signal) {
        long cycle = 0;
        while (running) {
            cycle++;
            try {
                long cycleStart = System.nanoTime();
                if (criticalWarming) {
                    WarmingReport critical = warmCriticalData();
                    log.debug("Critical warming completed succeeded={} durationMs={}",
                            critical.getSucceeded(), critical.getDurationMs());
                }
                if (patternWarming) {
                    WarmingReport pattern = warmByUsagePatterns(10, 0.1);
                    log.debug("Pattern warming completed succeeded={} durationMs={}",
                            pattern.getSucceeded(), pattern.getDurationMs());
                }
                log.info("Warming cycle completed cycle={} durationMs={}", cycle, elapsedMs(cycleStart));
            } catch (RuntimeException e) {
                log.error("Cache warming loop error cycle={} error={}", cycle, e.getMessage(), e);
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
     * Recompute every task's warming interval from its access frequency over the last hour:
     * above 1/min every 15 minutes, above 0.5 every 30, above 0.1 hourly, otherwise every 2 hours.
     */
    public List<ScheduleAdjustment> optimizeSchedules() {
        List<ScheduleAdjustment> adjustments = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (WarmingTask task : tasks.values()) {
                double frequency = usageTracker.getAccessFrequency(task.getCacheKey(), FREQUENCY_WINDOW);
                Duration interval = intervalFor(frequency);
                task.reschedule(now, interval);
                adjustments.add(new ScheduleAdjustment(task.getTaskId(), frequency, interval));
            }
        } finally {
            lock.unlock();
        }
        log.info("Warming schedules optimized tasksOptimized={}", adjustments.size());
        return adjustments;
    }

    static Duration intervalFor(double accessesPerMinute) {
        if (accessesPerMinute > 1.0) {
            return Duration.ofMinutes(15);
        }
        if (accessesPerMinute > 0.5) {
            return Duration.ofMinutes(30);
        }
        if (accessesPerMinute > 0.1) {
            return Duration.ofMinutes(60);
        }
        return Duration.ofMinutes(120);
    }

    public WarmingPerformance getPerformanceStats() {
        lock.lock();
        try {
            double avg = totalWarmings == 0 ? 0 : totalDurationMs / totalWarmings;
            return WarmingPerformance.builder()
                    .totalWarmings(totalWarmings)
                    .totalDurationMs(totalDurationMs)
                    .avgDurationMs(avg)
                    .fastestMs(totalWarmings == 0 ? 0 : fastestMs)
                    .slowestMs(slowestMs)
                    .efficiencyScore(totalWarmings == 0 ? 0 : 100 * (1 - Math.min(avg / 1000, 1)))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public WarmingStats getStats() {
        lock.lock();
        try {
            List<TaskDetails> details = new ArrayList<>();
            for (WarmingTask task : tasks.values()) {
                details.add(TaskDetails.builder()
                        .taskId(task.getTaskId())
                        .name(task.getName())
                        .enabled(task.isEnabled())
                        .priority(task.getPriority())
                        .critical(criticalKeys.contains(task.getCacheKey()))
                        .runCount(task.getRunCount())
                        .avgDurationMs(task.getAvgDurationMs())
                        .lastRun(task.getLastRun())
                        .nextRun(task.getNextRun())
                        .build());
            }
            return WarmingStats.builder()
                    .tasks(tasks.size())
                    .criticalKeys(criticalKeys.size())
                    .running(running)
                    .usersPreloaded(userPreloads.size())
                    .performance(getPerformanceStats())
                    .taskDetails(details)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public UsagePatternTracker getUsageTracker() {
        return usageTracker;
    }

    public boolean isRunning() {
        return running;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
