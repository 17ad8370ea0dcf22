package com.questrail.scheduler.remote;

import com.questrail.scheduler.api.Scheduler;
import com.questrail.scheduler.directory.InMemorySchedulerDirectory;
import com.questrail.scheduler.remote.config.RemoteSchedulerConfig;
import com.questrail.scheduler.remote.observability.RecordingObservabilitySink;
import com.questrail.scheduler.remote.observability.SchedulerDirectoryEvent;
import com.questrail.scheduler.remote.observability.Slf4jRemoteSchedulerObservabilitySink;
import com.questrail.scheduler.remote.transport.CountingEndpointFactory;
import com.questrail.scheduler.remote.transport.FakeRemoteSchedulerEndpoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RemoteSchedulerFactoryTest
{
    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private final RemoteSchedulerConfig config = RemoteSchedulerConfig.builder()
            .withSchedulerId("reporting")
            .build();
    private final InMemorySchedulerDirectory directory = new InMemorySchedulerDirectory();
    private final FakeRemoteSchedulerEndpoint engine = new FakeRemoteSchedulerEndpoint("RemoteEngine");
    private final CountingEndpointFactory endpoints = new CountingEndpointFactory(engine);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private RemoteSchedulerFactory factory() {
        return new RemoteSchedulerFactory(config, directory, endpoints, sink, () -> T0);
    }

    @Test
    void firstCallRegistersProxyWithoutConnecting() {
        Scheduler scheduler = factory().getScheduler();

        assertInstanceOf(RemoteScheduler.class, scheduler);
        assertEquals("reporting", ((RemoteScheduler) scheduler).schedulerId());
        assertSame(scheduler, directory.lookup("reporting").orElseThrow());
        assertEquals(0, endpoints.createCount());
        assertEquals(List.of(SchedulerDirectoryEvent.Kind.REGISTERED), sink.directoryKinds());
    }

    @Test
    void laterCallsReturnTheRegisteredInstance() {
        RemoteSchedulerFactory factory = factory();

        Scheduler first = factory.getScheduler();
        Scheduler second = factory.getScheduler();
        Scheduler fromOtherFactory = factory().getScheduler();

        assertSame(first, second);
        assertSame(first, fromOtherFactory);
        assertEquals(1, sink.directoryKinds().size());
    }

    @Test
    void shutdownLetsFactoryBuildAFreshProxy() {
        RemoteSchedulerFactory factory = factory();
        Scheduler first = factory.getScheduler();

        first.shutdown();
        Scheduler second = factory.getScheduler();

        assertNotSame(first, second);
        assertSame(second, directory.lookup("reporting").orElseThrow());
        assertEquals(List.of(
                SchedulerDirectoryEvent.Kind.REGISTERED,
                SchedulerDirectoryEvent.Kind.REMOVED,
                SchedulerDirectoryEvent.Kind.REGISTERED), sink.directoryKinds());
    }

    @Test
    void repeatedShutdownOfReplacedProxyLeavesNewEntry() {
        RemoteSchedulerFactory factory = factory();
        Scheduler first = factory.getScheduler();
        first.shutdown();
        Scheduler second = factory.getScheduler();

        first.shutdown();

        assertSame(second, directory.lookup("reporting").orElseThrow());
        assertEquals(List.of(
                SchedulerDirectoryEvent.Kind.REGISTERED,
                SchedulerDirectoryEvent.Kind.REMOVED,
                SchedulerDirectoryEvent.Kind.REGISTERED), sink.directoryKinds());
    }

    @Test
    void proxyFromFactoryForwardsToEngine() {
        Scheduler scheduler = new RemoteSchedulerFactory(config, directory, endpoints,
                new Slf4jRemoteSchedulerObservabilitySink(), () -> T0).getScheduler();

        assertEquals("RemoteEngine", scheduler.getSchedulerName());
        assertEquals(1, endpoints.createCount());
    }

    @Test
    void rmiDefaultsComeFromConfig() {
        RemoteSchedulerFactory factory = new RemoteSchedulerFactory(config, directory);

        assertSame(config, factory.config());
        assertTrue(factory.getScheduler() instanceof RemoteScheduler);
    }
}
