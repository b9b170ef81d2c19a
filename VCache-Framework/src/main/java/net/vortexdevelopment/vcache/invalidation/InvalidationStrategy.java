package net.vortexdevelopment.vcache.invalidation;

/**
 * How a matching rule is dispatched for a write.
 */
public enum InvalidationStrategy {
    /** Invalidate synchronously. */
    IMMEDIATE("immediate"),
    /** Merge into the pending set and invalidate when the debounce timer fires. */
    BATCHED("batched"),
    /** Mark matching memory entries stale; they are dropped on next read. */
    LAZY("lazy"),
    /** Invalidate synchronously, then walk the dependents of every affected key. */
    CASCADE("cascade");

    private final String id;

    InvalidationStrategy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
