package com.forecast.sync.sync;

/**
 * Receives {@link SyncEvent}s from the write-back worker, e.g. to push status to connected
 * clients. Called on the worker thread; implementations must return quickly.
 */
@FunctionalInterface
public interface SyncEventListener {

    void onSyncEvent(SyncEvent event);
}
