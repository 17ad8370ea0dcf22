package com.questrail.scheduler.api;

/**
 * SchedulerException
 * -----------------------------------------------------------------------------
 * Root of every failure raised through the {@link Scheduler} API.
 *
 * <p>An instance of this exact type (or of an engine-defined subclass such as
 * {@link ObjectAlreadyExistsException}) signals a <em>domain</em> failure: the
 * scheduling engine received the request and rejected it. Remote proxies pass
 * such failures through unchanged.</p>
 *
 * <p>Failures that originate in the proxy itself use the dedicated subclasses
 * {@link SchedulerConnectionException}, {@link SchedulerCommunicationException},
 * {@link UnableToInterruptJobException}, {@link UnsupportedLocalOperationException}
 * and {@link SchedulerCallCancelledException}, so a caller can tell "the engine
 * rejected this" apart from "the engine was unreachable".</p>
 */
public class SchedulerException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
