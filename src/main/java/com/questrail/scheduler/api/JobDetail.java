package com.questrail.scheduler.api;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Definition of a job as stored by the scheduler.
 *
 * <p>The job class is carried by name only: the class is loaded inside the
 * remote engine's process, never by the proxy.</p>
 *
 * @param durable          whether the job is kept after its last trigger is removed
 * @param requestsRecovery whether the job is re-executed after an engine crash
 * @param jobData          immutable data handed to each execution; values may be {@code null}
 */
public record JobDetail(
        JobKey key,
        String jobClassName,
        String description,
        boolean durable,
        boolean requestsRecovery,
        Map<String, Object> jobData
) implements Serializable {

    private static final long serialVersionUID = 1L;

    public JobDetail {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(jobClassName, "jobClassName");
        jobData = jobData == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(jobData));
    }

    public static JobDetail of(JobKey key, String jobClassName) {
        return new JobDetail(key, jobClassName, null, false, false, Map.of());
    }

    public static JobDetail durable(JobKey key, String jobClassName) {
        return new JobDetail(key, jobClassName, null, true, false, Map.of());
    }
}
