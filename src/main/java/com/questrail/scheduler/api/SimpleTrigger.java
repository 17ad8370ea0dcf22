package com.questrail.scheduler.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Trigger that fires at a start time and then repeats at a fixed interval.
 *
 * @param repeatCount number of repeats after the first firing, or
 *                    {@link #REPEAT_INDEFINITELY}
 */
public record SimpleTrigger(
        TriggerKey key,
        JobKey jobKey,
        Instant startTime,
        Duration repeatInterval,
        int repeatCount,
        int priority,
        String calendarName
) implements Trigger {

    private static final long serialVersionUID = 1L;

    public static final int REPEAT_INDEFINITELY = -1;

    public SimpleTrigger {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(jobKey, "jobKey");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(repeatInterval, "repeatInterval");

        if (repeatInterval.isNegative()) {
            throw new IllegalArgumentException("repeatInterval must be non-negative");
        }
        if (repeatCount < REPEAT_INDEFINITELY) {
            throw new IllegalArgumentException("repeatCount must be >= " + REPEAT_INDEFINITELY);
        }
    }

    /**
     * Creates a trigger that fires exactly once at {@code startTime}.
     */
    public static SimpleTrigger once(TriggerKey key, JobKey jobKey, Instant startTime) {
        return new SimpleTrigger(key, jobKey, startTime, Duration.ZERO, 0, DEFAULT_PRIORITY, null);
    }
}
