package com.questrail.scheduler.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyTests
{
    @Test
    void missingGroupIsDefault() {
        JobKey key = JobKey.jobKey("report");

        assertEquals(Key.DEFAULT_GROUP, key.group());
        assertEquals("DEFAULT.report", key.toString());
        assertEquals(key, JobKey.jobKey("report", null));
    }

    @Test
    void nameIsRequired() {
        assertThrows(NullPointerException.class, () -> JobKey.jobKey(null));
    }

    @Test
    void jobAndTriggerKeysAreNeverEqual() {
        assertNotEquals(JobKey.jobKey("x", "g"), TriggerKey.triggerKey("x", "g"));
    }

    @Test
    void defaultGroupSortsFirstThenGroupThenName() {
        List<TriggerKey> keys = new ArrayList<>(List.of(
                TriggerKey.triggerKey("b", "alpha"),
                TriggerKey.triggerKey("z"),
                TriggerKey.triggerKey("a", "beta"),
                TriggerKey.triggerKey("a", "alpha"),
                TriggerKey.triggerKey("a")));

        Collections.sort(keys);

        assertEquals(List.of(
                TriggerKey.triggerKey("a"),
                TriggerKey.triggerKey("z"),
                TriggerKey.triggerKey("a", "alpha"),
                TriggerKey.triggerKey("b", "alpha"),
                TriggerKey.triggerKey("a", "beta")), keys);
    }
}
