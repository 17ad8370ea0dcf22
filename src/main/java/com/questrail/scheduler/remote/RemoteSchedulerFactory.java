package com.questrail.scheduler.remote;

import com.questrail.scheduler.api.ObjectAlreadyExistsException;
import com.questrail.scheduler.api.Scheduler;
import com.questrail.scheduler.directory.SchedulerDirectory;
import com.questrail.scheduler.internal.time.SystemWallClock;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.remote.config.RemoteSchedulerConfig;
import com.questrail.scheduler.remote.observability.NullObservabilitySink;
import com.questrail.scheduler.remote.observability.RemoteSchedulerObservabilitySink;
import com.questrail.scheduler.remote.observability.SchedulerDirectoryEvent;
import com.questrail.scheduler.remote.transport.RemoteEndpointFactory;
import com.questrail.scheduler.remote.transport.rmi.RmiEndpointFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * RemoteSchedulerFactory
 * =============================================================================
 * Composition root that hands out the process's proxy for one configured
 * remote scheduler.
 *
 * <p>{@link #getScheduler()} first consults the {@link SchedulerDirectory}. If
 * a scheduler is registered under the configured id it is returned as-is;
 * otherwise a new {@link RemoteScheduler} is built, registered and returned.
 * After the proxy's successful {@code shutdown()} the entry is gone and the
 * next call builds a fresh proxy.</p>
 *
 * <p>No remote call is made here. The proxy connects lazily on its first
 * operation.</p>
 */
public final class RemoteSchedulerFactory
{
    private static final Logger log = LoggerFactory.getLogger(RemoteSchedulerFactory.class);

    private final RemoteSchedulerConfig config;
    private final SchedulerDirectory directory;
    private final RemoteEndpointFactory endpointFactory;
    private final RemoteSchedulerObservabilitySink observabilitySink;
    private final WallClock clock;

    /**
     * Creates a factory whose proxies resolve the engine from the RMI registry
     * named in {@code config}.
     */
    public RemoteSchedulerFactory(RemoteSchedulerConfig config, SchedulerDirectory directory) {
        this(config, directory, RmiEndpointFactory.fromConfig(config), NullObservabilitySink.INSTANCE,
                SystemWallClock.INSTANCE);
    }

    public RemoteSchedulerFactory(RemoteSchedulerConfig config,
                                  SchedulerDirectory directory,
                                  RemoteEndpointFactory endpointFactory,
                                  RemoteSchedulerObservabilitySink observabilitySink,
                                  WallClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the scheduler registered under the configured id, creating and
     * registering a remote proxy if there is none.
     */
    public Scheduler getScheduler() {
        String id = config.schedulerId();

        Optional<Scheduler> existing = directory.lookup(id);
        if (existing.isPresent()) {
            log.debug("Using registered scheduler '{}'", id);
            return existing.get();
        }

        RemoteScheduler scheduler = RemoteScheduler.builder()
                .withSchedulerId(id)
                .withEndpointFactory(endpointFactory)
                .withDirectory(directory)
                .withObservabilitySink(observabilitySink)
                .withWallClock(clock)
                .build();

        try {
            directory.register(id, scheduler);
        } catch (ObjectAlreadyExistsException e) {
            // Another caller registered first; hand out its instance.
            log.debug("Scheduler '{}' registered concurrently, using existing entry", id);
            return directory.lookup(id).orElseThrow(() -> e);
        }

        observabilitySink.onDirectoryEvent(new SchedulerDirectoryEvent(
                clock.now(), id, SchedulerDirectoryEvent.Kind.REGISTERED));
        log.info("Registered remote scheduler proxy '{}' using {}", id, endpointFactory);
        return scheduler;
    }

    public RemoteSchedulerConfig config() {
        return config;
    }
}
