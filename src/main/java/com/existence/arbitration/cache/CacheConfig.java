package com.existence.arbitration.cache;

/**
 * Configuration for the existence cache.
 *
 * @param maxSize maximum number of cached bindings
 */
public record CacheConfig(int maxSize) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default configuration: 50,000 bindings.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000);
    }
}
