package com.questrail.scheduler.api;

/**
 * Externally visible state of a trigger, as reported by
 * {@link Scheduler#getTriggerState(TriggerKey)}.
 */
public enum TriggerState
{
    /** No trigger is stored under the requested key. */
    NONE,

    /** The trigger is eligible to fire. */
    NORMAL,

    PAUSED,

    /** The trigger has no remaining fire times. */
    COMPLETE,

    /** The trigger failed and will not fire until reset. */
    ERROR,

    /** The trigger is held because its job disallows concurrent execution. */
    BLOCKED
}
