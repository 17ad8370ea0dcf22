package com.questrail.scheduler.api;

import java.io.Serializable;
import java.util.Objects;

/**
 * Key
 * -----------------------------------------------------------------------------
 * Base type for the {@code (name, group)} identities of jobs and triggers.
 *
 * <h2>Equality and Identity</h2>
 * Two keys are equal when they are of the same concrete type and carry the
 * same name and group. A {@code null} group is normalized to
 * {@link #DEFAULT_GROUP} at construction, so {@code jobKey("a")} and
 * {@code jobKey("a", "DEFAULT")} are the same key.
 *
 * <h2>Ordering</h2>
 * Keys order by group first, then by name. The default group sorts ahead of
 * every other group.
 *
 * <p>Keys are immutable and {@link Serializable}; they travel to the remote
 * engine unchanged.</p>
 */
public abstract class Key<K extends Key<K>> implements Comparable<K>, Serializable
{
    private static final long serialVersionUID = 1L;

    /**
     * Group used when none is given.
     */
    public static final String DEFAULT_GROUP = "DEFAULT";

    private final String name;
    private final String group;

    protected Key(String name, String group) {
        this.name = Objects.requireNonNull(name, "name");
        this.group = group == null ? DEFAULT_GROUP : group;
    }

    public String name() {
        return name;
    }

    public String group() {
        return group;
    }

    @Override
    public int compareTo(K other) {
        if (group.equals(DEFAULT_GROUP) && !other.group().equals(DEFAULT_GROUP)) {
            return -1;
        }
        if (!group.equals(DEFAULT_GROUP) && other.group().equals(DEFAULT_GROUP)) {
            return 1;
        }

        int byGroup = group.compareTo(other.group());
        if (byGroup != 0) {
            return byGroup;
        }
        return name.compareTo(other.name());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Key<?> that = (Key<?>) o;
        return name.equals(that.name) && group.equals(that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, group);
    }

    @Override
    public String toString() {
        return group + "." + name;
    }
}
