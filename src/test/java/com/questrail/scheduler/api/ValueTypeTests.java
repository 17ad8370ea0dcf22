package com.questrail.scheduler.api;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ValueTypeTests
{
    private static Map<String, Object> withNullEntry() {
        Map<String, Object> values = new HashMap<>();
        values.put("region", "eu-west");
        values.put("optional", null);
        return values;
    }

    @Test
    void jobDataMayHoldNullValues() {
        Map<String, Object> source = withNullEntry();

        JobDetail job = new JobDetail(JobKey.jobKey("j"), "com.example.ReportJob", null, true, false, source);
        source.put("late", "ignored");

        assertTrue(job.jobData().containsKey("optional"));
        assertNull(job.jobData().get("optional"));
        assertEquals(Set.of("region", "optional"), job.jobData().keySet());
        assertThrows(UnsupportedOperationException.class, () -> job.jobData().put("x", 1));
    }

    @Test
    void missingJobDataIsEmpty() {
        JobDetail job = new JobDetail(JobKey.jobKey("j"), "com.example.ReportJob", null, false, false, null);

        assertTrue(job.jobData().isEmpty());
        assertEquals(JobDetail.of(JobKey.jobKey("j"), "com.example.ReportJob"), job);
    }

    @Test
    void contextMayHoldNullValues() {
        SchedulerContext context = new SchedulerContext(withNullEntry());

        assertEquals(Set.of("region", "optional"), context.keys());
        assertEquals(Optional.empty(), context.get("optional"));
        assertEquals(Optional.of("eu-west"), context.get("region"));
        assertFalse(context.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> context.values().remove("region"));
    }

    @Test
    void metaDataSummaryDescribesJobStore() {
        SchedulerMetaData meta = new SchedulerMetaData("Reporting", "node-1", Scheduler.class,
                false, true, false, false, Optional.of(Instant.parse("2024-03-01T09:00:00Z")),
                4, "RAMJobStore", false, true, "SimpleThreadPool", 10, "1.0");

        String summary = meta.summary();

        assertTrue(summary.startsWith("Scheduler 'Reporting' with instanceId 'node-1'\n"), summary);
        assertTrue(summary.contains("  Running since: 2024-03-01T09:00:00Z\n"), summary);
        assertTrue(summary.contains("  Number of jobs executed: 4\n"), summary);
        assertTrue(summary.contains("  Using thread pool 'SimpleThreadPool' with 10 threads.\n"), summary);
        assertTrue(summary.contains(
                "  Using job-store 'RAMJobStore' - which does not support persistence and is clustered.\n"), summary);
        assertTrue(summary.endsWith("  Engine version: 1.0"), summary);
        assertFalse(summary.contains("access via remote proxy"), summary);
    }

    @Test
    void metaDataSummaryReportsShutdown() {
        SchedulerMetaData meta = new SchedulerMetaData("Reporting", "node-1", Scheduler.class,
                true, true, false, true, Optional.empty(),
                0, "RAMJobStore", true, false, "SimpleThreadPool", 1, "1.0");

        String summary = meta.summary();

        assertTrue(summary.contains("  Scheduler has been shutdown.\n"), summary);
        assertTrue(summary.contains("which supports persistence and is not clustered."), summary);
    }
}
