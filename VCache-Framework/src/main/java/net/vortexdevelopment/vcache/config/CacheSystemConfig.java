package net.vortexdevelopment.vcache.config;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.monitor.AlertThresholds;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Settings for every cache component.
 * <p>
 * Built with {@link #builder()} (unset values keep their defaults) or loaded with
 * {@link #load()}, which reads {@code vcache.properties} from the classpath and then
 * applies {@code vcache.*} system properties on top.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
public class CacheSystemConfig {

    public static final String RESOURCE = "vcache.properties";
    public static final String PREFIX = "vcache.";

    // Memory layer
    @Builder.Default
    private final int memoryMaxEntries = 1000;
    @Builder.Default
    private final Duration defaultTtl = Duration.ofHours(1);

    // Persistent layer
    @Builder.Default
    private final boolean persistentEnabled = false;
    @Builder.Default
    private final String databaseType = "h2";
    @Builder.Default
    private final String databaseHost = "localhost";
    @Builder.Default
    private final String databasePort = "3306";
    @Builder.Default
    private final String databaseName = "vcache";
    @Builder.Default
    private final String databaseUsername = "sa";
    @Builder.Default
    private final String databasePassword = "";
    @Builder.Default
    private final int databaseMaxPoolSize = 10;
    @Builder.Default
    private final String h2File = "mem";
    @Builder.Default
    private final String persistentTable = "cache_entries";

    // Invalidation
    @Builder.Default
    private final long batchDelayMs = 100;
    @Builder.Default
    private final int relatedTagDepth = 2;
    @Builder.Default
    private final boolean installDefaultRules = true;

    // Monitoring
    @Builder.Default
    private final boolean monitoringEnabled = false;
    @Builder.Default
    private final Duration monitorInterval = Duration.ofSeconds(60);
    @Builder.Default
    private final boolean autoCleanup = true;
    @Builder.Default
    private final double cleanupThreshold = 0.9;
    @Builder.Default
    private final int metricsHistorySize = 1000;
    @Builder.Default
    private final AlertThresholds alertThresholds = AlertThresholds.defaults();

    // Warming
    @Builder.Default
    private final boolean warmingEnabled = false;
    @Builder.Default
    private final Duration warmingInterval = Duration.ofMinutes(60);
    @Builder.Default
    private final int usageHistorySize = 1000;
    @Builder.Default
    private final int criticalPriority = 50;
    @Builder.Default
    private final Duration userCooldown = Duration.ofMinutes(5);
    @Builder.Default
    private final int maxUserSubResources = 5;

    /** Bounded wait for background threads on shutdown. */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(5);

    public static CacheSystemConfig defaults() {
        return CacheSystemConfig.builder().build();
    }

    /**
     * Load from {@code vcache.properties} on the classpath, overridden by system properties.
     */
    public static CacheSystemConfig load() {
        Properties properties = new Properties();
        try (InputStream in = CacheSystemConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                log.info("Loaded cache configuration resource={}", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Build a config from {@code vcache.*} properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static CacheSystemConfig fromProperties(Properties properties) {
        CacheSystemConfig defaults = defaults();
        PropertyReader reader = new PropertyReader(properties);

        AlertThresholds thresholdDefaults = defaults.getAlertThresholds();
        AlertThresholds thresholds = AlertThresholds.builder()
                .hitRateLow(reader.get("monitor.hit-rate-low", Double::parseDouble, thresholdDefaults.getHitRateLow()))
                .utilizationHigh(reader.get("monitor.utilization-high", Double::parseDouble, thresholdDefaults.getUtilizationHigh()))
                .evictionRateHigh(reader.get("monitor.eviction-rate-high", Double::parseDouble, thresholdDefaults.getEvictionRateHigh()))
                .degradationThreshold(reader.get("monitor.degradation-threshold", Double::parseDouble, thresholdDefaults.getDegradationThreshold()))
                .minRequestsForHitRateAlert(reader.get("monitor.min-requests", Long::parseLong, thresholdDefaults.getMinRequestsForHitRateAlert()))
                .build();

        CacheSystemConfig config = CacheSystemConfig.builder()
                .memoryMaxEntries(reader.get("memory.max-entries", Integer::parseInt, defaults.getMemoryMaxEntries()))
                .defaultTtl(reader.get("memory.default-ttl-seconds", PropertyReader::seconds, defaults.getDefaultTtl()))
                .persistentEnabled(reader.get("persistent.enabled", Boolean::parseBoolean, defaults.isPersistentEnabled()))
                .databaseType(reader.get("persistent.type", Function.identity(), defaults.getDatabaseType()))
                .databaseHost(reader.get("persistent.host", Function.identity(), defaults.getDatabaseHost()))
                .databasePort(reader.get("persistent.port", Function.identity(), defaults.getDatabasePort()))
                .databaseName(reader.get("persistent.database", Function.identity(), defaults.getDatabaseName()))
                .databaseUsername(reader.get("persistent.username", Function.identity(), defaults.getDatabaseUsername()))
                .databasePassword(reader.get("persistent.password", Function.identity(), defaults.getDatabasePassword()))
                .databaseMaxPoolSize(reader.get("persistent.max-pool-size", Integer::parseInt, defaults.getDatabaseMaxPoolSize()))
                .h2File(reader.get("persistent.h2-file", Function.identity(), defaults.getH2File()))
                .persistentTable(reader.get("persistent.table", Function.identity(), defaults.getPersistentTable()))
                .batchDelayMs(reader.get("invalidation.batch-delay-ms", Long::parseLong, defaults.getBatchDelayMs()))
                .relatedTagDepth(reader.get("invalidation.related-tag-depth", Integer::parseInt, defaults.getRelatedTagDepth()))
                .installDefaultRules(reader.get("invalidation.default-rules", Boolean::parseBoolean, defaults.isInstallDefaultRules()))
                .monitoringEnabled(reader.get("monitor.enabled", Boolean::parseBoolean, defaults.isMonitoringEnabled()))
                .monitorInterval(reader.get("monitor.interval-seconds", PropertyReader::seconds, defaults.getMonitorInterval()))
                .autoCleanup(reader.get("monitor.auto-cleanup", Boolean::parseBoolean, defaults.isAutoCleanup()))
                .cleanupThreshold(reader.get("monitor.cleanup-threshold", Double::parseDouble, defaults.getCleanupThreshold()))
                .metricsHistorySize(reader.get("monitor.history-size", Integer::parseInt, defaults.getMetricsHistorySize()))
                .alertThresholds(thresholds)
                .warmingEnabled(reader.get("warming.enabled", Boolean::parseBoolean, defaults.isWarmingEnabled()))
                .warmingInterval(reader.get("warming.interval-minutes", PropertyReader::minutes, defaults.getWarmingInterval()))
                .usageHistorySize(reader.get("warming.history-size", Integer::parseInt, defaults.getUsageHistorySize()))
                .criticalPriority(reader.get("warming.critical-priority", Integer::parseInt, defaults.getCriticalPriority()))
                .userCooldown(reader.get("warming.user-cooldown-seconds", PropertyReader::seconds, defaults.getUserCooldown()))
                .maxUserSubResources(reader.get("warming.max-user-sub-resources", Integer::parseInt, defaults.getMaxUserSubResources()))
                .shutdownTimeout(reader.get("shutdown-timeout-seconds", PropertyReader::seconds, defaults.getShutdownTimeout()))
                .build();
        config.validate();
        return config;
    }

    /**
     * @throws IllegalArgumentException on out of range values
     */
    public void validate() {
        if (memoryMaxEntries < 1) {
            throw new IllegalArgumentException("memoryMaxEntries must be at least 1: " + memoryMaxEntries);
        }
        if (defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be non-negative: " + defaultTtl);
        }
        if (cleanupThreshold <= 0 || cleanupThreshold > 1) {
            throw new IllegalArgumentException("cleanupThreshold must be in (0, 1]: " + cleanupThreshold);
        }
        if (metricsHistorySize < 1 || usageHistorySize < 1) {
            throw new IllegalArgumentException("History sizes must be at least 1");
        }
        if (monitorInterval.isZero() || monitorInterval.isNegative()) {
            throw new IllegalArgumentException("monitorInterval must be positive: " + monitorInterval);
        }
        if (warmingInterval.isZero() || warmingInterval.isNegative()) {
            throw new IllegalArgumentException("warmingInterval must be positive: " + warmingInterval);
        }
    }

    private static final class PropertyReader {
        private final Properties properties;

        private PropertyReader(Properties properties) {
            this.properties = properties;
        }

        private <T> T get(String key, Function<String, T> parser, T defaultValue) {
            String raw = properties.getProperty(PREFIX + key);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            try {
                return parser.apply(raw.trim());
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + raw, e);
            }
        }

        private static Duration seconds(String raw) {
            return Duration.ofSeconds(Long.parseLong(raw));
        }

        private static Duration minutes(String raw) {
            return Duration.ofMinutes(Long.parseLong(raw));
        }
    }
}
