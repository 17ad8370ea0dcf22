package com.questrail.scheduler.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time description of a scheduler's settings and capabilities.
 *
 * <p>The values are an instantaneous snapshot; they may differ as soon as the
 * record is returned.</p>
 */
public record SchedulerMetaData(
        String schedulerName,
        String schedulerInstanceId,
        Class<?> schedulerClass,
        boolean remote,
        boolean started,
        boolean inStandbyMode,
        boolean shutdown,
        Optional<Instant> runningSince,
        int numberOfJobsExecuted,
        String jobStoreClassName,
        boolean persistent,
        boolean clustered,
        String threadPoolClassName,
        int threadPoolSize,
        String version
) {
    public SchedulerMetaData {
        Objects.requireNonNull(schedulerName, "schedulerName");
        Objects.requireNonNull(schedulerInstanceId, "schedulerInstanceId");
        Objects.requireNonNull(schedulerClass, "schedulerClass");
        Objects.requireNonNull(runningSince, "runningSince");
    }

    /**
     * Returns a short multi-line description suitable for logs.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Scheduler '").append(schedulerName).append("' with instanceId '")
                .append(schedulerInstanceId).append("'\n");
        sb.append("  Scheduler class: '").append(schedulerClass.getName()).append('\'');
        if (remote) {
            sb.append(" - access via remote proxy");
        }
        sb.append('\n');

        if (shutdown) {
            sb.append("  Scheduler has been shutdown.\n");
        }
        else if (!started) {
            sb.append("  Scheduler has not been started.\n");
        }
        else {
            sb.append("  Running since: ").append(runningSince.map(Instant::toString).orElse("N/A")).append('\n');
            if (inStandbyMode) {
                sb.append("  Currently in standby mode.\n");
            }
        }

        sb.append("  Number of jobs executed: ").append(numberOfJobsExecuted).append('\n');
        sb.append("  Using thread pool '").append(threadPoolClassName).append("' with ")
                .append(threadPoolSize).append(" threads.\n");
        sb.append("  Using job-store '").append(jobStoreClassName).append("' - which ")
                .append(persistent ? "supports" : "does not support").append(" persistence and is ")
                .append(clustered ? "" : "not ").append("clustered.\n");
        sb.append("  Engine version: ").append(version);
        return sb.toString();
    }
}
