package com.questrail.scheduler.api;

/**
 * The operation only makes sense inside the process of the executing engine
 * and cannot be proxied. No remote call was attempted.
 */
public class UnsupportedLocalOperationException extends SchedulerException
{
    private static final long serialVersionUID = 1L;

    public UnsupportedLocalOperationException(String message) {
        super(message);
    }
}
