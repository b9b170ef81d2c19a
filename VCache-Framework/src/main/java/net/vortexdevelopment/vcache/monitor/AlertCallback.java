package net.vortexdevelopment.vcache.monitor;

@FunctionalInterface
public interface AlertCallback {

    void onAlert(CacheAlert alert) throws Exception;
}
