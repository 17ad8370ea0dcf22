package com.questrail.scheduler.api;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the listeners attached to a scheduler.
 *
 * <p>Listeners are invoked on the engine's own threads, so a listener manager
 * exists only in the engine's process. Remote proxies reject
 * {@link Scheduler#getListenerManager()}.</p>
 */
public interface ListenerManager
{
    void addJobListener(JobListener listener);

    boolean removeJobListener(String name);

    Optional<JobListener> getJobListener(String name);

    List<JobListener> getJobListeners();
}
