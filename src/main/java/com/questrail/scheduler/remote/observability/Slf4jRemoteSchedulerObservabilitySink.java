package com.questrail.scheduler.remote.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RemoteSchedulerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRemoteSchedulerObservabilitySink implements RemoteSchedulerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRemoteSchedulerObservabilitySink.class);

    @Override
    public void onConnectionEvent(RemoteConnectionEvent event) {
        switch (event.kind()) {
            case CONNECTED -> log.info("Remote scheduler '{}': handle acquired", event.schedulerId());
            case CONNECT_FAILED -> log.error("Remote scheduler '{}': could not acquire handle",
                event.schedulerId(), event.cause());
            case INVALIDATED -> log.warn("Remote scheduler '{}': handle invalidated, will reconnect on next call",
                event.schedulerId());
        }
    }

    @Override
    public void onCallFailure(RemoteCallFailureEvent event) {
        if (event.category() == RemoteCallFailureEvent.Category.COMMUNICATION) {
            log.warn("Remote scheduler '{}': {} failed in transit",
                event.schedulerId(), event.operation(), event.cause());
        }
        else {
            log.debug("Remote scheduler '{}': {} rejected by engine: {}",
                event.schedulerId(), event.operation(), event.cause().getMessage());
        }
    }

    @Override
    public void onDirectoryEvent(SchedulerDirectoryEvent event) {
        log.info("Scheduler directory: '{}' {}", event.schedulerId(), event.kind());
    }
}
