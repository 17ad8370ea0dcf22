package com.questrail.scheduler.remote.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RemoteSchedulerConfigTest
{
    @Test
    void builderDefaults() {
        RemoteSchedulerConfig config = RemoteSchedulerConfig.builder()
                .withSchedulerId("reporting")
                .build();

        assertEquals("reporting", config.schedulerId());
        assertEquals(RemoteSchedulerConfig.DEFAULT_REGISTRY_HOST, config.registryHost());
        assertEquals(RemoteSchedulerConfig.DEFAULT_REGISTRY_PORT, config.registryPort());
        assertEquals("reporting", config.bindName());
    }

    @Test
    void blankIdAndBadPortAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RemoteSchedulerConfig.builder().withSchedulerId("  ").build());
        assertThrows(NullPointerException.class,
                () -> RemoteSchedulerConfig.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> RemoteSchedulerConfig.builder().withSchedulerId("x").withRegistryPort(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RemoteSchedulerConfig.builder().withSchedulerId("x").withRegistryPort(70000).build());
    }

    @Test
    void fromPropertiesReadsEveryKey() {
        Properties p = new Properties();
        p.setProperty(RemoteSchedulerConfig.PROP_SCHEDULER_ID, "reporting");
        p.setProperty(RemoteSchedulerConfig.PROP_REGISTRY_HOST, "sched-01.internal");
        p.setProperty(RemoteSchedulerConfig.PROP_REGISTRY_PORT, " 2099 ");
        p.setProperty(RemoteSchedulerConfig.PROP_BIND_NAME, "ReportingEngine");

        RemoteSchedulerConfig config = RemoteSchedulerConfig.fromProperties(p);

        assertEquals(new RemoteSchedulerConfig("reporting", "sched-01.internal", 2099, "ReportingEngine"), config);
    }

    @Test
    void fromPropertiesTreatsBlankValuesAsMissing() {
        Properties p = new Properties();
        p.setProperty(RemoteSchedulerConfig.PROP_SCHEDULER_ID, "reporting");
        p.setProperty(RemoteSchedulerConfig.PROP_REGISTRY_HOST, "");
        p.setProperty(RemoteSchedulerConfig.PROP_BIND_NAME, "   ");

        RemoteSchedulerConfig config = RemoteSchedulerConfig.fromProperties(p);

        assertEquals("localhost", config.registryHost());
        assertEquals("reporting", config.bindName());
    }

    @Test
    void fromPropertiesRequiresId() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RemoteSchedulerConfig.fromProperties(new Properties()));

        assertEquals("Missing required property 'scheduler.remote.id'", e.getMessage());
    }

    @Test
    void fromPropertiesRejectsNonNumericPort() {
        Properties p = new Properties();
        p.setProperty(RemoteSchedulerConfig.PROP_SCHEDULER_ID, "reporting");
        p.setProperty(RemoteSchedulerConfig.PROP_REGISTRY_PORT, "ninety");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RemoteSchedulerConfig.fromProperties(p));

        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void loadsFromClasspathResource() throws IOException {
        Properties p = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/scheduler-remote.properties")) {
            assertNotNull(in, "test resource missing");
            p.load(in);
        }

        RemoteSchedulerConfig config = RemoteSchedulerConfig.fromProperties(p);

        assertEquals("reporting", config.schedulerId());
        assertEquals(1199, config.registryPort());
        assertEquals("QuartzScheduler_reporting", config.bindName());
    }
}
