package com.forecast.sync.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The running jobs returned by {@link JobScheduler#start}. Owns the executor; pass it back to
 * {@link JobScheduler#stop} to release it.
 */
public final class ScheduledJobs {

    public static final String SYNC_JOB = "write-back-sync";
    public static final String RETENTION_JOB = "raw-intake-retention";

    private final ScheduledExecutorService executor;
    private final JobHandle sync;
    private final JobHandle retention;

    ScheduledJobs(ScheduledExecutorService executor, JobHandle sync, JobHandle retention) {
        this.executor = executor;
        this.sync = sync;
        this.retention = retention;
    }

    ScheduledExecutorService executor() {
        return executor;
    }

    public Optional<JobHandle> sync() {
        return Optional.ofNullable(sync);
    }

    public Optional<JobHandle> retention() {
        return Optional.ofNullable(retention);
    }

    public List<JobHandle> all() {
        List<JobHandle> handles = new ArrayList<>(2);
        if (sync != null) {
            handles.add(sync);
        }
        if (retention != null) {
            handles.add(retention);
        }
        return handles;
    }

    public boolean isStopped() {
        return executor.isShutdown();
    }
}
