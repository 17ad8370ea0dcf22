package com.questrail.scheduler.remote.internal;

import com.questrail.scheduler.api.SchedulerCommunicationException;
import com.questrail.scheduler.api.SchedulerException;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.remote.observability.RemoteCallFailureEvent;
import com.questrail.scheduler.remote.observability.RemoteSchedulerObservabilitySink;

import java.util.Objects;

/**
 * RemoteFailureTranslator
 * -----------------------------------------------------------------------------
 * Turns a {@link CallResult} into either its value or the exception the
 * caller sees.
 *
 * <ul>
 *   <li>{@link CallResult.Ok}: the value is returned unchanged.</li>
 *   <li>{@link CallResult.CommunicationFailure}: the handle is invalidated,
 *       then a {@link SchedulerCommunicationException} naming the scheduler and
 *       the operation is raised with the transport failure as its cause.</li>
 *   <li>{@link CallResult.DomainFailure}: the engine's exception is rethrown
 *       as-is. The handle is kept; the engine answered, so the channel works.</li>
 * </ul>
 *
 * Nothing is retried here.
 */
public final class RemoteFailureTranslator
{
    private final String schedulerId;
    private final RemoteEndpointHandle handle;
    private final RemoteSchedulerObservabilitySink sink;
    private final WallClock clock;

    public RemoteFailureTranslator(String schedulerId,
                                   RemoteEndpointHandle handle,
                                   RemoteSchedulerObservabilitySink sink,
                                   WallClock clock)
    {
        this.schedulerId = Objects.requireNonNull(schedulerId, "schedulerId");
        this.handle = Objects.requireNonNull(handle, "handle");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param operation name of the scheduler operation, used in messages and events
     * @throws SchedulerCommunicationException on a transport failure
     * @throws SchedulerException the engine's own exception on a domain failure
     */
    public <T> T translate(String operation, CallResult<T> result) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(result, "result");

        if (result instanceof CallResult.Ok<T> ok) {
            return ok.value();
        }

        if (result instanceof CallResult.CommunicationFailure<T> failure) {
            handle.invalidate(failure.cause());
            sink.onCallFailure(new RemoteCallFailureEvent(
                    clock.now(), schedulerId, operation,
                    RemoteCallFailureEvent.Category.COMMUNICATION, failure.cause()));
            throw new SchedulerCommunicationException(
                    "Error communicating with remote scheduler '" + schedulerId + "' during " + operation + ".",
                    failure.cause());
        }

        if (result instanceof CallResult.DomainFailure<T> failure) {
            sink.onCallFailure(new RemoteCallFailureEvent(
                    clock.now(), schedulerId, operation,
                    RemoteCallFailureEvent.Category.DOMAIN, failure.cause()));
            throw failure.cause();
        }

        throw new IllegalStateException("Unhandled call result: " + result);
    }
}
