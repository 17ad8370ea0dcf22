package com.questrail.scheduler.remote.observability;

/**
 * No-op implementation of RemoteSchedulerObservabilitySink.
 */
public final class NullObservabilitySink implements RemoteSchedulerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(RemoteConnectionEvent event) {}

    @Override
    public void onCallFailure(RemoteCallFailureEvent event) {}

    @Override
    public void onDirectoryEvent(SchedulerDirectoryEvent event) {}
}
