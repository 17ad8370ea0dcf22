package com.questrail.scheduler.api;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Describes one in-progress execution of a job.
 *
 * @param fireInstanceId engine-assigned id of this firing; accepted by
 *                       {@link Scheduler#interrupt(String)}
 */
public record JobExecutionContext(
        String fireInstanceId,
        JobDetail jobDetail,
        Trigger trigger,
        Instant fireTime,
        Instant scheduledFireTime,
        int refireCount
) implements Serializable {

    private static final long serialVersionUID = 1L;

    public JobExecutionContext {
        Objects.requireNonNull(fireInstanceId, "fireInstanceId");
        Objects.requireNonNull(jobDetail, "jobDetail");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(fireTime, "fireTime");
    }

    public JobKey jobKey() {
        return jobDetail.key();
    }
}
