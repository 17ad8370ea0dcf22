package com.questrail.scheduler.api;

/**
 * Identity of a job registered with a scheduler.
 */
public final class JobKey extends Key<JobKey>
{
    private static final long serialVersionUID = 1L;

    public JobKey(String name, String group) {
        super(name, group);
    }

    public static JobKey jobKey(String name) {
        return new JobKey(name, null);
    }

    public static JobKey jobKey(String name, String group) {
        return new JobKey(name, group);
    }
}
