package net.vortexdevelopment.vcache.cache;

/**
 * Produces a value for a cache key on a miss.
 * Runs synchronously on the calling thread; the cache applies no timeout.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface ComputeFunction<T> {

    /**
     * Compute the value. Must not return null.
     *
     * @return the computed value
     * @throws Exception if the value cannot be computed
     */
    T compute() throws Exception;
}
