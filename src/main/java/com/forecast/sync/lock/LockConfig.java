package com.forecast.sync.lock;

/**
 * Configuration for lock acquisition.
 *
 * @param timeoutMs maximum time to wait for a lock
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
