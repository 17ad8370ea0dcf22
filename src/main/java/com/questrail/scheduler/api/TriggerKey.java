package com.questrail.scheduler.api;

/**
 * Identity of a trigger registered with a scheduler.
 */
public final class TriggerKey extends Key<TriggerKey>
{
    private static final long serialVersionUID = 1L;

    public TriggerKey(String name, String group) {
        super(name, group);
    }

    public static TriggerKey triggerKey(String name) {
        return new TriggerKey(name, null);
    }

    public static TriggerKey triggerKey(String name, String group) {
        return new TriggerKey(name, group);
    }
}
