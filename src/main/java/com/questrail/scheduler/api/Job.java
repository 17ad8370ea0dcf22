package com.questrail.scheduler.api;

/**
 * A unit of work executed by a scheduler when one of its triggers fires.
 */
public interface Job
{
    void execute(JobExecutionContext context);
}
