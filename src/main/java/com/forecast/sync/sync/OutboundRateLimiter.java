package com.forecast.sync.sync;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every outbound call of the sync worker. Callers block until a token is
 * available, so a whole cycle stays under the configured request rate.
 */
public class OutboundRateLimiter {

    private static final long SCALE = 1000;

    private final long maxTokens;
    private final double refillPerNano;
    private final AtomicLong tokens;
    private final AtomicLong lastRefillNanos;
    private final LongSupplier nanoTime;

    public OutboundRateLimiter(double requestsPerSecond) {
        this(requestsPerSecond, System::nanoTime);
    }

    OutboundRateLimiter(double requestsPerSecond, LongSupplier nanoTime) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0");
        }
        // one second of burst, at least one request
        this.maxTokens = Math.max(1, (long) Math.floor(requestsPerSecond));
        this.refillPerNano = requestsPerSecond / 1_000_000_000.0;
        this.tokens = new AtomicLong(maxTokens * SCALE);
        this.nanoTime = nanoTime;
        this.lastRefillNanos = new AtomicLong(nanoTime.getAsLong());
    }

    /**
     * Takes a token if one is available right now.
     */
    public boolean tryAcquire() {
        refill();
        while (true) {
            long current = tokens.get();
            if (current < SCALE) {
                return false;
            }
            if (tokens.compareAndSet(current, current - SCALE)) {
                return true;
            }
        }
    }

    /**
     * Waits for a token.
     *
     * @return how long the caller waited
     * @throws InterruptedException if interrupted while waiting
     */
    public Duration acquire() throws InterruptedException {
        long start = nanoTime.getAsLong();
        while (!tryAcquire()) {
            long missing = SCALE - tokens.get();
            long waitNanos = Math.max(100_000L, (long) ((double) missing / SCALE / refillPerNano));
            TimeUnit.NANOSECONDS.sleep(Math.min(waitNanos, 100_000_000L));
        }
        return Duration.ofNanos(nanoTime.getAsLong() - start);
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long last = lastRefillNanos.get();
        long elapsed = now - last;
        if (elapsed <= 0) {
            return;
        }
        long newTokens = (long) (elapsed * refillPerNano * SCALE);
        if (newTokens <= 0) {
            return;
        }
        if (lastRefillNanos.compareAndSet(last, now)) {
            tokens.updateAndGet(current -> Math.min(maxTokens * SCALE, current + newTokens));
        }
    }

    long availableTokens() {
        refill();
        return tokens.get() / SCALE;
    }
}
