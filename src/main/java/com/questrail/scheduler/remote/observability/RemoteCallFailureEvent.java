package com.questrail.scheduler.remote.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a failed call through the proxy.
 *
 * @param operation name of the scheduler operation, e.g. {@code "pauseJob"}
 */
public record RemoteCallFailureEvent(
    Instant timestamp,
    String schedulerId,
    String operation,
    Category category,
    Throwable cause
) {
    public enum Category {
        /** The call failed in transit; the handle was invalidated. */
        COMMUNICATION,
        /** The engine rejected the call. */
        DOMAIN
    }

    public RemoteCallFailureEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(schedulerId, "schedulerId");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(cause, "cause");
    }
}
