package com.forecast.sync.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One scheduled job. A disabled job keeps its schedule but skips its body until re-enabled.
 */
public class JobHandle {
    private static final Logger log = LoggerFactory.getLogger(JobHandle.class);

    private final String name;
    private final Runnable job;
    private final Duration interval;
    private final Clock clock;
    private final AtomicBoolean enabled = new AtomicBoolean(true);
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicReference<Instant> nextRunAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastRunAt = new AtomicReference<>();
    private volatile ScheduledFuture<?> future;

    JobHandle(String name, Runnable job, Duration interval, Duration initialDelay, Clock clock) {
        this.name = name;
        this.job = job;
        this.interval = interval;
        this.clock = clock;
        this.nextRunAt.set(clock.instant().plus(initialDelay));
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    /**
     * Body run by the executor. Failures are logged so the schedule survives them.
     */
    void tick() {
        try {
            if (!enabled.get()) {
                log.debug("schedule.skipped job={} reason=disabled", name);
                return;
            }
            lastRunAt.set(clock.instant());
            runs.incrementAndGet();
            job.run();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.error("schedule.jobFailed job={}", name, e);
        } finally {
            nextRunAt.set(clock.instant().plus(interval));
        }
    }

    void cancel() {
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }

    public String getName() {
        return name;
    }

    public void enable() {
        if (enabled.compareAndSet(false, true)) {
            log.info("schedule.enabled job={}", name);
        }
    }

    public void disable() {
        if (enabled.compareAndSet(true, false)) {
            log.info("schedule.disabled job={}", name);
        }
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public boolean isCancelled() {
        ScheduledFuture<?> current = future;
        return current != null && current.isCancelled();
    }

    /**
     * When the job body will next run; empty while disabled or after the job was stopped.
     */
    public Optional<Instant> nextRunTime() {
        if (!enabled.get() || isCancelled()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nextRunAt.get());
    }

    public Optional<Instant> lastRunTime() {
        return Optional.ofNullable(lastRunAt.get());
    }

    public long runCount() {
        return runs.get();
    }

    public long failureCount() {
        return failures.get();
    }
}
