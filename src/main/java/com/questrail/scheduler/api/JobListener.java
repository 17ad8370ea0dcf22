package com.questrail.scheduler.api;

/**
 * Receives notifications around job executions.
 */
public interface JobListener
{
    String name();

    default void jobToBeExecuted(JobExecutionContext context) {
    }

    /**
     * @param failure the failure raised by the job, or {@code null} on success
     */
    default void jobWasExecuted(JobExecutionContext context, SchedulerException failure) {
    }
}
