package net.vortexdevelopment.vcache.monitor;

/**
 * Coarse classification attached to analysis reports.
 */
public enum HealthStatus {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    CRITICAL,
    OK,
    WARNING;

    public static HealthStatus forHitRate(double hitRate) {
        if (hitRate >= 0.9) {
            return EXCELLENT;
        }
        if (hitRate >= 0.7) {
            return GOOD;
        }
        if (hitRate >= 0.5) {
            return FAIR;
        }
        return POOR;
    }

    public static HealthStatus forUtilization(double utilization) {
        if (utilization < 0.7) {
            return GOOD;
        }
        if (utilization < 0.9) {
            return FAIR;
        }
        return CRITICAL;
    }
}
