package net.vortexdevelopment.vcache.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheSystemConfigTest {

    @Test
    void testDefaults() {
        CacheSystemConfig config = CacheSystemConfig.defaults();

        assertThat(config.getMemoryMaxEntries()).isEqualTo(1000);
        assertThat(config.getDefaultTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.isPersistentEnabled()).isFalse();
        assertThat(config.getBatchDelayMs()).isEqualTo(100);
        assertThat(config.getRelatedTagDepth()).isEqualTo(2);
        assertThat(config.getMonitorInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getCleanupThreshold()).isEqualTo(0.9);
        assertThat(config.getAlertThresholds().getHitRateLow()).isEqualTo(0.7);
        assertThat(config.getUserCooldown()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getCriticalPriority()).isEqualTo(50);
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("vcache.memory.max-entries", "250");
        properties.setProperty("vcache.memory.default-ttl-seconds", "30");
        properties.setProperty("vcache.persistent.type", "mariadb");
        properties.setProperty("vcache.invalidation.default-rules", "false");
        properties.setProperty("vcache.monitor.hit-rate-low", "0.5");
        properties.setProperty("vcache.monitor.min-requests", "10");
        properties.setProperty("vcache.warming.interval-minutes", "15");
        properties.setProperty("vcache.warming.user-cooldown-seconds", " 90 ");
        properties.setProperty("vcache.persistent.password", "");

        CacheSystemConfig config = CacheSystemConfig.fromProperties(properties);

        assertThat(config.getMemoryMaxEntries()).isEqualTo(250);
        assertThat(config.getDefaultTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getDatabaseType()).isEqualTo("mariadb");
        assertThat(config.isInstallDefaultRules()).isFalse();
        assertThat(config.getAlertThresholds().getHitRateLow()).isEqualTo(0.5);
        assertThat(config.getAlertThresholds().getMinRequestsForHitRateAlert()).isEqualTo(10);
        assertThat(config.getAlertThresholds().getUtilizationHigh()).isEqualTo(0.9);
        assertThat(config.getWarmingInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.getUserCooldown()).isEqualTo(Duration.ofSeconds(90));
        assertThat(config.getDatabasePassword()).isEmpty();
        assertThat(config.getBatchDelayMs()).isEqualTo(100);
    }

    @Test
    void testInvalidNumberIsReported() {
        Properties properties = new Properties();
        properties.setProperty("vcache.memory.max-entries", "lots");

        assertThatThrownBy(() -> CacheSystemConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vcache.memory.max-entries");
    }

    @Test
    void testValidation() {
        assertThatThrownBy(() -> CacheSystemConfig.builder().cleanupThreshold(1.5).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheSystemConfig.builder().memoryMaxEntries(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheSystemConfig.builder().monitorInterval(Duration.ZERO).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSystemPropertiesOverrideResource() {
        System.setProperty("vcache.memory.max-entries", "42");
        try {
            CacheSystemConfig config = CacheSystemConfig.load();

            assertThat(config.getMemoryMaxEntries()).isEqualTo(42);
            assertThat(config.getDefaultTtl()).isEqualTo(Duration.ofHours(1));
        } finally {
            System.clearProperty("vcache.memory.max-entries");
        }
    }

    @Test
    void testToBuilderKeepsOtherValues() {
        CacheSystemConfig base = CacheSystemConfig.builder().memoryMaxEntries(5).build();

        CacheSystemConfig copy = base.toBuilder().monitoringEnabled(true).build();

        assertThat(copy.getMemoryMaxEntries()).isEqualTo(5);
        assertThat(copy.isMonitoringEnabled()).isTrue();
    }
}
