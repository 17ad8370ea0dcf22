package com.questrail.scheduler.store;

import com.questrail.scheduler.api.TriggerState;

/**
 * InternalTriggerState
 * -----------------------------------------------------------------------------
 * Lifecycle tag an engine attaches to each stored trigger.
 *
 * <p>This enum defines the legal states only. Transitions between them are
 * decided by the engine that owns the {@link TriggerWrapper}; no transition
 * table lives here.</p>
 */
public enum InternalTriggerState
{
    /** Initial state; eligible for acquisition by a firing pass. */
    WAITING,

    /** Reserved by a firing pass that has not yet started the job. */
    ACQUIRED,

    /** The job is currently running for this trigger. */
    EXECUTING,

    /** Terminal: the trigger has no remaining fire times. */
    COMPLETE,

    /** Held because the job disallows concurrent execution. */
    BLOCKED,

    PAUSED,

    /** Paused while also held by a non-concurrent job. */
    PAUSED_AND_BLOCKED,

    /** Terminal until reset by {@code resetTriggerFromErrorState}. */
    ERROR;

    /**
     * Maps this internal state to the state reported through the public API.
     */
    public TriggerState toTriggerState() {
        return switch (this) {
            case WAITING, ACQUIRED, EXECUTING -> TriggerState.NORMAL;
            case PAUSED, PAUSED_AND_BLOCKED -> TriggerState.PAUSED;
            case BLOCKED -> TriggerState.BLOCKED;
            case COMPLETE -> TriggerState.COMPLETE;
            case ERROR -> TriggerState.ERROR;
        };
    }
}
