package com.questrail.scheduler.remote.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a change a proxy made to the scheduler directory.
 */
public record SchedulerDirectoryEvent(
    Instant timestamp,
    String schedulerId,
    Kind kind
) {
    public enum Kind {
        REGISTERED,
        REMOVED
    }

    public SchedulerDirectoryEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(schedulerId, "schedulerId");
        Objects.requireNonNull(kind, "kind");
    }
}
