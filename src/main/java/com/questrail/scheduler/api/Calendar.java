package com.questrail.scheduler.api;

import java.io.Serializable;
import java.time.Instant;

/**
 * Excludes blocks of time from the fire times of the triggers that reference
 * it by name.
 */
public interface Calendar extends Serializable
{
    /**
     * @return {@code true} if a trigger may fire at {@code time}
     */
    boolean isTimeIncluded(Instant time);

    /**
     * @return a human-readable description, or {@code null}
     */
    default String description() {
        return null;
    }
}
