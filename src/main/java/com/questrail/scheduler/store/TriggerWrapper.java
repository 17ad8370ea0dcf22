package com.questrail.scheduler.store;

import com.questrail.scheduler.api.JobKey;
import com.questrail.scheduler.api.Trigger;
import com.questrail.scheduler.api.TriggerKey;
import com.questrail.scheduler.api.TriggerState;

import java.util.Objects;

/**
 * TriggerWrapper
 * -----------------------------------------------------------------------------
 * Binds a stored {@link Trigger} to the mutable {@link InternalTriggerState}
 * an engine tracks for it.
 *
 * <h2>Equality and Identity</h2>
 * <b>Equality and hash code are based on the trigger key only.</b>
 * <p>
 * Neither the state nor the rest of the trigger payload takes part. Engines
 * keep wrappers in hash-based sets and maps and change {@link #state()} while
 * the wrapper is a member; if equality followed the state, every such change
 * would leave the wrapper in the wrong bucket. As a consequence two wrappers
 * with the same key are equal even when they wrap different trigger payloads.
 *
 * <h2>Threading</h2>
 * The state is mutated only by the owning engine, under that engine's own
 * locking. This class does no synchronization of its own.
 */
public final class TriggerWrapper
{
    private final Trigger trigger;

    private InternalTriggerState state = InternalTriggerState.WAITING;

    public TriggerWrapper(Trigger trigger) {
        this.trigger = Objects.requireNonNull(trigger, "trigger");
    }

    public Trigger trigger() {
        return trigger;
    }

    public TriggerKey triggerKey() {
        return trigger.key();
    }

    public JobKey jobKey() {
        return trigger.jobKey();
    }

    public InternalTriggerState state() {
        return state;
    }

    public void setState(InternalTriggerState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Returns the state reported for this trigger through the public API.
     */
    public TriggerState publicState() {
        return state.toTriggerState();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriggerWrapper that)) return false;
        return triggerKey().equals(that.triggerKey());
    }

    @Override
    public int hashCode() {
        return triggerKey().hashCode();
    }

    @Override
    public String toString() {
        return "TriggerWrapper[" + triggerKey() + ", " + state + "]";
    }
}
