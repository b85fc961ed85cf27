package com.forecast.sync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class OutboundRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);

    @Test
    @DisplayName("allows one second of burst then refuses")
    void burstThenRefuse() {
        OutboundRateLimiter limiter = new OutboundRateLimiter(5, nanos::get);

        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.tryAcquire(), "token " + i);
        }
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("refills at the configured rate")
    void refills() {
        OutboundRateLimiter limiter = new OutboundRateLimiter(10, nanos::get);
        while (limiter.tryAcquire()) {
            // drain
        }

        nanos.addAndGet(150_000_000L);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        nanos.addAndGet(5_000_000_000L);
        assertEquals(10, limiter.availableTokens(), "refill is capped at the burst size");
    }

    @Test
    @DisplayName("fractional rates still grant one request")
    void fractionalRate() {
        OutboundRateLimiter limiter = new OutboundRateLimiter(0.5, nanos::get);

        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        nanos.addAndGet(3_000_000_000L);
        assertTrue(limiter.tryAcquire());
    }

    @Test
    @DisplayName("acquire waits for a token with the real clock")
    void acquireBlocks() throws InterruptedException {
        OutboundRateLimiter limiter = new OutboundRateLimiter(20);
        for (int i = 0; i < 20; i++) {
            limiter.acquire();
        }

        assertTrue(limiter.acquire().toMillis() >= 10);
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new OutboundRateLimiter(0));
    }
}
