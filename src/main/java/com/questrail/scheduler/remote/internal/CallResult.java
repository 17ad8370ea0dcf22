package com.questrail.scheduler.remote.internal;

import com.questrail.scheduler.api.SchedulerException;
import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;

import java.rmi.RemoteException;
import java.util.Objects;

/**
 * CallResult
 * -----------------------------------------------------------------------------
 * Outcome of a single endpoint invocation, classified once at the call site.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Ok}: the engine returned a value (possibly {@code null})</li>
 *   <li>{@link CommunicationFailure}: the call failed in transit</li>
 *   <li>{@link DomainFailure}: the engine rejected the call</li>
 * </ul>
 *
 * <p>Only {@link RemoteException} and {@link SchedulerException} are
 * classified. Any other exception escaping the endpoint is a defect on one
 * side of the channel and propagates unchanged from {@link #invoke}.</p>
 */
public sealed interface CallResult<T>
{
    record Ok<T>(T value) implements CallResult<T> {
    }

    record CommunicationFailure<T>(RemoteException cause) implements CallResult<T> {
        public CommunicationFailure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    record DomainFailure<T>(SchedulerException cause) implements CallResult<T> {
        public DomainFailure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    /**
     * Runs {@code call} against {@code endpoint} and classifies the outcome.
     */
    static <T> CallResult<T> invoke(RemoteSchedulerEndpoint endpoint, RemoteCall<T> call) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(call, "call");

        try {
            return new Ok<>(call.apply(endpoint));
        } catch (RemoteException e) {
            return new CommunicationFailure<>(e);
        } catch (SchedulerException e) {
            return new DomainFailure<>(e);
        }
    }

    default boolean isOk() {
        return this instanceof Ok;
    }
}
