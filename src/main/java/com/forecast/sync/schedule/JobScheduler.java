package com.forecast.sync.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts the write-back sync and retention jobs on fixed delays. Each {@link #start} call owns
 * its own executor, so several engines can be scheduled side by side.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Clock clock;

    public JobScheduler() {
        this(Clock.systemUTC());
    }

    public JobScheduler(Clock clock) {
        this.clock = clock;
    }

    public ScheduledJobs start(SchedulerConfig config, Runnable syncJob, Runnable retentionJob) {
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(2, daemonThreads());

        JobHandle sync = null;
        if (config.syncEnabled()) {
            sync = schedule(executor, ScheduledJobs.SYNC_JOB, syncJob,
                    config.syncInterval(), config.syncInitialDelay());
        } else {
            log.info("schedule.jobDisabled job={}", ScheduledJobs.SYNC_JOB);
        }

        JobHandle retention = null;
        if (config.retentionEnabled()) {
            retention = schedule(executor, ScheduledJobs.RETENTION_JOB, retentionJob,
                    config.retentionInterval(), config.retentionInitialDelay());
        } else {
            log.info("schedule.jobDisabled job={}", ScheduledJobs.RETENTION_JOB);
        }

        return new ScheduledJobs(executor, sync, retention);
    }

    /**
     * Cancels the jobs and waits up to {@code timeout} for a job in progress. Stopping twice is a
     * no-op.
     */
    public void stop(ScheduledJobs jobs, Duration timeout) {
        if (jobs.isStopped()) {
            return;
        }
        jobs.all().forEach(JobHandle::cancel);
        ScheduledExecutorService executor = jobs.executor();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("schedule.stopTimedOut timeout={}", timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("schedule.stopped jobs={}", jobs.all().size());
    }

    public void stop(ScheduledJobs jobs) {
        stop(jobs, Duration.ofSeconds(30));
    }

    private JobHandle schedule(ScheduledExecutorService executor, String name, Runnable job,
                               Duration interval, Duration initialDelay) {
        JobHandle handle = new JobHandle(name, job, interval, initialDelay, clock);
        handle.attach(executor.scheduleWithFixedDelay(handle::tick,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS));
        log.info("schedule.started job={} interval={} initialDelay={}", name, interval, initialDelay);
        return handle;
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "mirror-sync-scheduler-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
