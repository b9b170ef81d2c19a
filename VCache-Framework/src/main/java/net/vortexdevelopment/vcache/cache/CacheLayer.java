package net.vortexdevelopment.vcache.cache;

/**
 * Layers a {@link MultiLayerCache} can write to.
 */
public enum CacheLayer {
    /**
     * In-process LRU+TTL store.
     */
    MEMORY("memory"),

    /**
     * Durable backend behind the memory layer.
     */
    PERSISTENT("persistent");

    private final String id;

    CacheLayer(String id) {
        this.id = id;
    }

    /**
     * @return the lowercase identifier used in logs and metrics
     */
    public String id() {
        return id;
    }
}
