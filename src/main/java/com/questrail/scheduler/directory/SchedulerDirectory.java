package com.questrail.scheduler.directory;

import com.questrail.scheduler.api.ObjectAlreadyExistsException;
import com.questrail.scheduler.api.Scheduler;

import java.util.Optional;
import java.util.Set;

/**
 * SchedulerDirectory
 * -----------------------------------------------------------------------------
 * Name-keyed directory of the schedulers known to a process.
 *
 * <p>Name-based lookups resolve through the directory, so an entry must not
 * outlive the scheduler it names. Remote proxies remove their own entry after
 * a successful shutdown.</p>
 *
 * <p>The directory is an explicit collaborator: one instance is created at
 * process start and handed to every component that needs it. Tests substitute
 * a fresh instance.</p>
 *
 * <p>Implementations must be safe for concurrent use.</p>
 */
public interface SchedulerDirectory
{
    /**
     * Registers {@code scheduler} under {@code name}.
     *
     * @throws ObjectAlreadyExistsException if a scheduler is already registered under {@code name}
     */
    void register(String name, Scheduler scheduler);

    Optional<Scheduler> lookup(String name);

    /**
     * @return {@code true} if an entry was removed
     */
    boolean remove(String name);

    /**
     * Removes the entry for {@code name} only while it still maps to
     * {@code scheduler}.
     *
     * @return {@code true} if an entry was removed
     */
    boolean remove(String name, Scheduler scheduler);

    Set<String> names();
}
