package net.vortexdevelopment.vcache.monitor;

public enum Trend {
    IMPROVING,
    DEGRADING,
    STABLE
}
