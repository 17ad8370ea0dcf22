package com.questrail.scheduler.api;

/**
 * Raised when storing a job, trigger, calendar or scheduler under a name that
 * is already taken and replacement was not requested.
 */
public class ObjectAlreadyExistsException extends SchedulerException
{
    private static final long serialVersionUID = 1L;

    public ObjectAlreadyExistsException(String message) {
        super(message);
    }

    public static ObjectAlreadyExistsException forJob(JobKey key) {
        return new ObjectAlreadyExistsException(
                "Unable to store Job : '" + key + "', because one already exists with this identification.");
    }

    public static ObjectAlreadyExistsException forTrigger(TriggerKey key) {
        return new ObjectAlreadyExistsException(
                "Unable to store Trigger with name: '" + key.name() + "' and group: '" + key.group()
                        + "', because one already exists with this identification.");
    }
}
