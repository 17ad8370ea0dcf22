package com.questrail.scheduler.remote.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a change of the proxy's handle to the remote engine.
 *
 * @param cause the failure behind {@link Kind#CONNECT_FAILED} or
 *              {@link Kind#INVALIDATED}; {@code null} for {@link Kind#CONNECTED}
 */
public record RemoteConnectionEvent(
    Instant timestamp,
    String schedulerId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        /** A new handle was created and cached. */
        CONNECTED,
        /** The endpoint factory failed; no handle is cached. */
        CONNECT_FAILED,
        /** The cached handle was discarded after a transport failure. */
        INVALIDATED
    }

    public RemoteConnectionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(schedulerId, "schedulerId");
        Objects.requireNonNull(kind, "kind");
    }
}
