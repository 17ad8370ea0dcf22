package com.questrail.scheduler.api;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the application data a scheduler makes available to
 * the jobs it runs.
 *
 * <p>When read through a remote proxy the snapshot reflects the remote
 * engine's context at the time of the call; later changes on the engine are
 * not reflected.</p>
 *
 * <p>Entries may map to {@code null}; {@link #get} reports such an entry as
 * empty, {@link #keys} still lists it.</p>
 */
public record SchedulerContext(Map<String, Object> values) implements Serializable
{
    private static final long serialVersionUID = 1L;

    public static final SchedulerContext EMPTY = new SchedulerContext(Map.of());

    public SchedulerContext {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(values));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
