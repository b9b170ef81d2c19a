package net.vortexdevelopment.vcache.cache;

/**
 * Unchecked exception raised when a cached value cannot be produced.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }

    public CacheException(Throwable cause) {
        super(cause);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
