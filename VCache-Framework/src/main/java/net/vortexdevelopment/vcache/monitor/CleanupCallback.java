package net.vortexdevelopment.vcache.monitor;

/**
 * Invoked when cache cleanup is requested, manually or by the monitor on high utilization.
 */
@FunctionalInterface
public interface CleanupCallback {

    void cleanup() throws Exception;
}
