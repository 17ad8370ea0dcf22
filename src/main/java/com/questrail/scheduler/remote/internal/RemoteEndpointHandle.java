package com.questrail.scheduler.remote.internal;

import com.questrail.scheduler.api.SchedulerConnectionException;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.remote.observability.RemoteConnectionEvent;
import com.questrail.scheduler.remote.observability.RemoteSchedulerObservabilitySink;
import com.questrail.scheduler.remote.transport.RemoteEndpointFactory;
import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;

import java.util.Objects;

/**
 * RemoteEndpointHandle
 * -----------------------------------------------------------------------------
 * Lazily created, cached reference to the remote engine.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   empty --get()--> factory.create() --> cached
 *   cached --invalidate()--> empty
 * </pre>
 * The handle starts empty, is filled on first use, is emptied whenever a call
 * through it fails in transit, and is refilled on the next use. There is no
 * background reconnection, retry or backoff.
 *
 * <h2>Threading model</h2>
 * The cached reference is the only shared mutable state. Reads are
 * {@code volatile}; installing and clearing it take a private lock. Neither
 * the factory nor any remote call runs while the lock is held.
 * <p>
 * Two races are tolerated:
 * <ul>
 *   <li>Threads that find the handle empty at the same time may each call the
 *       factory; the last one to install wins.</li>
 *   <li>A thread may clear a handle another thread has just installed; the
 *       next call reconnects.</li>
 * </ul>
 * Both cost at most an extra factory call, since every operation fetches the
 * handle again before use.
 */
public final class RemoteEndpointHandle
{
    private final Object lock = new Object();

    private final String schedulerId;
    private final RemoteEndpointFactory factory;
    private final RemoteSchedulerObservabilitySink sink;
    private final WallClock clock;

    private volatile RemoteSchedulerEndpoint cached;

    public RemoteEndpointHandle(String schedulerId,
                                RemoteEndpointFactory factory,
                                RemoteSchedulerObservabilitySink sink,
                                WallClock clock)
    {
        this.schedulerId = Objects.requireNonNull(schedulerId, "schedulerId");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached endpoint, creating it first if the handle is empty.
     *
     * @throws SchedulerConnectionException if the factory fails; the handle stays empty
     */
    public RemoteSchedulerEndpoint get() {
        RemoteSchedulerEndpoint current = cached;
        if (current != null) {
            return current;
        }

        final RemoteSchedulerEndpoint created;
        try {
            created = factory.create();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw connectFailed(e);
        }

        if (created == null) {
            throw connectFailed(new IllegalStateException("Endpoint factory returned null"));
        }

        synchronized (lock) {
            cached = created;
        }

        sink.onConnectionEvent(new RemoteConnectionEvent(
                clock.now(), schedulerId, RemoteConnectionEvent.Kind.CONNECTED, null));
        return created;
    }

    /**
     * Discards the cached endpoint. Idempotent.
     */
    public void invalidate() {
        invalidate(null);
    }

    /**
     * Discards the cached endpoint after {@code cause} was observed on it.
     */
    public void invalidate(Throwable cause) {
        final boolean discarded;
        synchronized (lock) {
            discarded = cached != null;
            cached = null;
        }

        if (discarded) {
            sink.onConnectionEvent(new RemoteConnectionEvent(
                    clock.now(), schedulerId, RemoteConnectionEvent.Kind.INVALIDATED, cause));
        }
    }

    public boolean isConnected() {
        return cached != null;
    }

    private SchedulerConnectionException connectFailed(Exception cause) {
        sink.onConnectionEvent(new RemoteConnectionEvent(
                clock.now(), schedulerId, RemoteConnectionEvent.Kind.CONNECT_FAILED, cause));
        return new SchedulerConnectionException(
                "Could not get handle to remote scheduler: " + cause.getMessage(), cause);
    }
}
