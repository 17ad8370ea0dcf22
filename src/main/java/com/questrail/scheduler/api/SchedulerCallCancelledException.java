package com.questrail.scheduler.api;

/**
 * The calling thread was interrupted before the call was dispatched. No
 * remote call was attempted and the thread's interrupt status is left set.
 */
public class SchedulerCallCancelledException extends SchedulerException
{
    private static final long serialVersionUID = 1L;

    public SchedulerCallCancelledException(String message) {
        super(message);
    }
}
