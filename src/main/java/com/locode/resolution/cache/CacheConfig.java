package com.locode.resolution.cache;

/**
 * Configuration for the analysis cache.
 * Entries never expire: the catalog is immutable once built, so a cached result stays valid.
 *
 * @param maxSize maximum number of cached queries
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default configuration: 1,000 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
