package com.questrail.scheduler.api;

/**
 * Produces {@link Job} instances for the engine that executes them.
 *
 * <p>A job factory is only meaningful in the same process as the executing
 * engine. Remote proxies reject it; see
 * {@link Scheduler#setJobFactory(JobFactory)}.</p>
 */
@FunctionalInterface
public interface JobFactory
{
    Job newJob(JobDetail jobDetail, Trigger trigger);
}
