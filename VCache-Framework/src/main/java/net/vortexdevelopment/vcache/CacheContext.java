package net.vortexdevelopment.vcache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.CacheStore;
import net.vortexdevelopment.vcache.cache.MultiLayerCache;
import net.vortexdevelopment.vcache.cache.NoOpPersistentBackend;
import net.vortexdevelopment.vcache.cache.PersistentBackend;
import net.vortexdevelopment.vcache.cache.backend.CacheDatabase;
import net.vortexdevelopment.vcache.cache.backend.JdbcPersistentBackend;
import net.vortexdevelopment.vcache.config.CacheSystemConfig;
import net.vortexdevelopment.vcache.invalidation.DefaultInvalidationRules;
import net.vortexdevelopment.vcache.invalidation.DependencyTracker;
import net.vortexdevelopment.vcache.invalidation.InvalidationEngine;
import net.vortexdevelopment.vcache.invalidation.WriteContext;
import net.vortexdevelopment.vcache.invalidation.WriteOperation;
import net.vortexdevelopment.vcache.monitor.CacheMonitor;
import net.vortexdevelopment.vcache.monitor.MetricsCollector;
import net.vortexdevelopment.vcache.monitor.PerformanceAnalyzer;
import net.vortexdevelopment.vcache.warming.UsagePatternTracker;
import net.vortexdevelopment.vcache.warming.UserDataLoader;
import net.vortexdevelopment.vcache.warming.WarmingEngine;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.Map;

/**
 * Owns one instance of every cache component, wired together from a {@link CacheSystemConfig}.
 * Build it once and pass it to the code that needs caching.
 *
 * <pre>{@code
 * try (CacheContext context = CacheContext.builder().config(CacheSystemConfig.load()).build()) {
 *     context.start();
 *     Object user = context.getCache().getOrCompute(CacheKeys.userSession("42"), loader, null, Set.of("user:42"));
 *     context.recordWrite("user", "42");
 * }
 * }</pre>
 */
@Slf4j
@Getter
public class CacheContext implements AutoCloseable {

    private final CacheSystemConfig config;
    private final Clock clock;
    private final CacheStore memoryStore;
    private final PersistentBackend persistentBackend;
    private final MultiLayerCache cache;
    private final DependencyTracker dependencyTracker;
    private final InvalidationEngine invalidationEngine;
    private final MetricsCollector metricsCollector;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final CacheMonitor monitor;
    private final UsagePatternTracker usageTracker;
    private final WarmingEngine warmingEngine;
    @Nullable
    @Getter(AccessLevel.NONE)
    private final CacheDatabase ownedDatabase;

    @Builder
    private CacheContext(@Nullable CacheSystemConfig config, @Nullable Clock clock,
                         @Nullable PersistentBackend persistentBackend, @Nullable UserDataLoader userDataLoader) {
        this.config = config == null ? CacheSystemConfig.defaults() : config;
        this.config.validate();
        this.clock = clock == null ? Clock.systemUTC() : clock;

        this.memoryStore = new CacheStore(this.config.getMemoryMaxEntries(), this.config.getDefaultTtl(), this.clock);

        if (persistentBackend != null) {
            this.persistentBackend = persistentBackend;
            this.ownedDatabase = null;
        } else if (this.config.isPersistentEnabled()) {
            this.ownedDatabase = new CacheDatabase(this.config.getDatabaseType(), this.config.getDatabaseHost(),
                    this.config.getDatabasePort(), this.config.getDatabaseName(), this.config.getDatabaseUsername(),
                    this.config.getDatabasePassword(), this.config.getDatabaseMaxPoolSize(), this.config.getH2File());
            this.persistentBackend = openJdbcBackend(this.ownedDatabase, this.config, this.clock);
        } else {
            this.persistentBackend = new NoOpPersistentBackend();
            this.ownedDatabase = null;
        }

        this.cache = new MultiLayerCache(memoryStore, this.persistentBackend);

        this.dependencyTracker = new DependencyTracker();
        this.invalidationEngine = new InvalidationEngine(cache, dependencyTracker, this.config.getBatchDelayMs(),
                this.config.getRelatedTagDepth(), this.clock);
        if (this.config.isInstallDefaultRules()) {
            DefaultInvalidationRules.install(invalidationEngine);
        }

        this.metricsCollector = new MetricsCollector(this.config.getMetricsHistorySize(), this.clock);
        this.performanceAnalyzer = new PerformanceAnalyzer(cache, metricsCollector, this.config.getAlertThresholds(), this.clock);
        this.monitor = CacheMonitor.builder()
                .cache(cache)
                .analyzer(performanceAnalyzer)
                .interval(this.config.getMonitorInterval())
                .autoCleanup(this.config.isAutoCleanup())
                .cleanupThreshold(this.config.getCleanupThreshold())
                .joinTimeout(this.config.getShutdownTimeout())
                .clock(this.clock)
                .build();

        this.usageTracker = new UsagePatternTracker(this.config.getUsageHistorySize(), this.clock);
        cache.addAccessListener(usageTracker::recordAccess);
        this.warmingEngine = WarmingEngine.builder()
                .cache(cache)
                .usageTracker(usageTracker)
                .userDataLoader(userDataLoader)
                .clock(this.clock)
                .criticalPriority(this.config.getCriticalPriority())
                .userCooldown(this.config.getUserCooldown())
                .maxUserSubResources(this.config.getMaxUserSubResources())
                .joinTimeout(this.config.getShutdownTimeout())
                .build();

        log.info("Cache context created maxEntries={} persistent={} defaultRules={}",
                this.config.getMemoryMaxEntries(), this.persistentBackend.isEnabled(), this.config.isInstallDefaultRules());
    }

    /**
     * Start the background loops enabled in the config.
     */
    public void start() {
        if (config.isMonitoringEnabled()) {
            monitor.start();
        }
        if (config.isWarmingEnabled()) {
            warmingEngine.startBackgroundWarming(config.getWarmingInterval(), true, true);
        }
    }

    /**
     * Invalidate cache entries affected by a write to a resource.
     *
     * @return number of entries invalidated
     */
    public int recordWrite(String resourceType, @Nullable String resourceId) {
        return invalidationEngine.invalidateByWrite(resourceType, resourceId);
    }

    public int recordWrite(String resourceType, @Nullable String resourceId, WriteOperation operation,
                           @Nullable Map<String, Object> attributes) {
        return invalidationEngine.invalidateByWrite(resourceType, resourceId, operation, attributes);
    }

    public int recordWrite(WriteContext context) {
        return invalidationEngine.invalidateByWrite(context);
    }

    /**
     * Start the pool and create the cache table. The pool is shut down again if the table
     * cannot be created.
     */
    static JdbcPersistentBackend openJdbcBackend(CacheDatabase database, CacheSystemConfig config, Clock clock) {
        database.init();
        try {
            JdbcPersistentBackend backend = new JdbcPersistentBackend(database, config.getPersistentTable(),
                    config.getDefaultTtl(), clock, new ObjectMapper());
            backend.init();
            return backend;
        } catch (RuntimeException e) {
            database.shutdown();
            throw e;
        }
    }

    /**
     * Stop background loops, flush pending invalidations and close the owned database pool.
     */
    @Override
    public void close() {
        warmingEngine.stopBackgroundWarming();
        monitor.stop();
        invalidationEngine.shutdown();
        if (ownedDatabase != null) {
            ownedDatabase.shutdown();
        }
        log.info("Cache context closed");
    }
}
