package com.questrail.scheduler.remote.observability;

/**
 * Main interface for receiving remote scheduler proxy observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the caller's thread, in the middle of a scheduler call.
 * Implementations must be fast and must not throw.</p>
 */
public interface RemoteSchedulerObservabilitySink {
    /**
     * Called when the handle to the remote engine is created, fails to be
     * created, or is discarded.
     * @param event the connection event
     */
    void onConnectionEvent(RemoteConnectionEvent event);

    /**
     * Called when a forwarded call fails.
     * @param event the failure details
     */
    void onCallFailure(RemoteCallFailureEvent event);

    /**
     * Called when a proxy registers in, or removes itself from, the scheduler directory.
     * @param event the directory event
     */
    void onDirectoryEvent(SchedulerDirectoryEvent event);
}
