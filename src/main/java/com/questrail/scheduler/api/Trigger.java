package com.questrail.scheduler.api;

import java.io.Serializable;
import java.time.Instant;

/**
 * Trigger
 * -----------------------------------------------------------------------------
 * A rule describing when a job should run.
 *
 * <p>The proxy never evaluates a trigger. Fire-time computation, misfire
 * handling and persistence belong to the remote engine, so this interface only
 * exposes the identity and the attributes a caller needs to inspect what it
 * scheduled.</p>
 */
public interface Trigger extends Serializable
{
    int DEFAULT_PRIORITY = 5;

    TriggerKey key();

    /**
     * @return key of the job this trigger fires
     */
    JobKey jobKey();

    /**
     * @return time of the first scheduled firing
     */
    Instant startTime();

    int priority();

    /**
     * @return name of the calendar excluding fire times, or {@code null} if none
     */
    String calendarName();
}
