package com.forecast.sync.mirror;

/**
 * Configuration for the merged-view count cache.
 *
 * @param maxSize    maximum number of cached (organization, filter) counts
 * @param ttlSeconds time-to-live in seconds for each count
 * @param enabled    whether counts are cached at all
 */
public record CountCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CountCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 counts, 30s TTL, enabled.
     */
    public static CountCacheConfig defaults() {
        return new CountCacheConfig(1_000, 30, true);
    }

    public static CountCacheConfig disabled() {
        return new CountCacheConfig(1, 1, false);
    }
}
