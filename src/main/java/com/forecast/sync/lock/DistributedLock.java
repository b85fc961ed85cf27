package com.forecast.sync.lock;

/**
 * Mutual exclusion keyed by string, used to serialize draft saves of one (mirror, user) pair.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on the key, waiting up to the configured timeout.
     *
     * @param key the lock key, e.g. {@code draft:<mirrorId>:<userId>}
     * @return true once acquired
     * @throws LockAcquisitionException if the lock is not acquired within the timeout
     */
    boolean tryLock(String key);

    void unlock(String key);
}
