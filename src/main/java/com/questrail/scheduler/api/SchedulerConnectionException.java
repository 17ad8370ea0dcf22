package com.questrail.scheduler.api;

/**
 * No handle to the remote scheduler could be obtained, for example because
 * its bind name could not be resolved.
 *
 * <p>The cause is the failure raised while creating the handle.</p>
 */
public class SchedulerConnectionException extends SchedulerException
{
    private static final long serialVersionUID = 1L;

    public SchedulerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
