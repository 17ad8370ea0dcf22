package com.questrail.scheduler.api;

/**
 * A transport-level failure interrupted an otherwise valid call to a remote
 * scheduler.
 *
 * <p>The cause is always the original transport failure. By the time this
 * exception is raised the proxy has discarded its handle, so the next call
 * reconnects. Whether the remote side effect happened is unknown.</p>
 */
public class SchedulerCommunicationException extends SchedulerException
{
    private static final long serialVersionUID = 1L;

    public SchedulerCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
