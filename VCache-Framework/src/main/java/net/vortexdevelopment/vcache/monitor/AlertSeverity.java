package net.vortexdevelopment.vcache.monitor;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
