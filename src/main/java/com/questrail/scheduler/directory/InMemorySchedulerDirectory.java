package com.questrail.scheduler.directory;

import com.questrail.scheduler.api.ObjectAlreadyExistsException;
import com.questrail.scheduler.api.Scheduler;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link SchedulerDirectory} backed by a {@link ConcurrentHashMap}.
 */
public final class InMemorySchedulerDirectory implements SchedulerDirectory
{
    private final ConcurrentMap<String, Scheduler> schedulers = new ConcurrentHashMap<>();

    @Override
    public void register(String name, Scheduler scheduler) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scheduler, "scheduler");

        if (schedulers.putIfAbsent(name, scheduler) != null) {
            throw new ObjectAlreadyExistsException("Scheduler with name '" + name + "' already exists.");
        }
    }

    @Override
    public Optional<Scheduler> lookup(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(schedulers.get(name));
    }

    @Override
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name");
        return schedulers.remove(name) != null;
    }

    @Override
    public boolean remove(String name, Scheduler scheduler) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scheduler, "scheduler");
        return schedulers.remove(name, scheduler);
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(schedulers.keySet());
    }
}
