package com.questrail.scheduler.api;

/**
 * A job execution could not be interrupted.
 *
 * <p>Raised both when the engine refuses the interrupt and when the call never
 * reached the engine. The cause tells the two apart: a
 * {@link SchedulerCommunicationException} or {@link SchedulerConnectionException}
 * for an unreachable engine, the engine's own {@link SchedulerException}
 * otherwise.</p>
 */
public class UnableToInterruptJobException extends SchedulerException
{
    private static final long serialVersionUID = 1L;

    public UnableToInterruptJobException(String message) {
        super(message);
    }

    public UnableToInterruptJobException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} if the interrupt failed because the engine was unreachable
     */
    public boolean isCommunicationFailure() {
        Throwable cause = getCause();
        return cause instanceof SchedulerCommunicationException
                || cause instanceof SchedulerConnectionException;
    }
}
