package com.forecast.sync.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-JVM lock backed by one {@link ReentrantLock} per key. Locks of released keys are
 * dropped so the map does not grow with every (mirror, user) pair ever edited.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            try {
                if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    throw new LockAcquisitionException(
                            "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
            }
            // the lock may have been dropped from the map while we waited for it
            if (locks.get(key) == lock) {
                log.debug("lock.acquired key={}", key);
                return true;
            }
            lock.unlock();
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            if (lock.getHoldCount() == 1 && !lock.hasQueuedThreads()) {
                locks.remove(key, lock);
            }
            lock.unlock();
            log.debug("lock.released key={}", key);
        }
    }

    int heldKeys() {
        return locks.size();
    }
}
