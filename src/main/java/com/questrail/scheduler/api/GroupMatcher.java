package com.questrail.scheduler.api;

import java.io.Serializable;
import java.util.Objects;

/**
 * GroupMatcher
 * -----------------------------------------------------------------------------
 * Selects job or trigger keys by comparing their group against a value.
 *
 * <p>Matchers are evaluated by the remote engine; the proxy passes them
 * through unchanged. {@link #isMatch(Key)} is exposed so test doubles and
 * engines share one definition of each operator.</p>
 */
public final class GroupMatcher<K extends Key<K>> implements Serializable
{
    private static final long serialVersionUID = 1L;

    public enum Operator {
        EQUALS,
        STARTS_WITH,
        ENDS_WITH,
        CONTAINS,
        ANYTHING;

        boolean evaluate(String group, String compareTo) {
            return switch (this) {
                case EQUALS -> group.equals(compareTo);
                case STARTS_WITH -> group.startsWith(compareTo);
                case ENDS_WITH -> group.endsWith(compareTo);
                case CONTAINS -> group.contains(compareTo);
                case ANYTHING -> true;
            };
        }
    }

    private final Operator operator;
    private final String compareTo;

    private GroupMatcher(Operator operator, String compareTo) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.compareTo = Objects.requireNonNull(compareTo, "compareTo");
    }

    public static <K extends Key<K>> GroupMatcher<K> groupEquals(String group) {
        return new GroupMatcher<>(Operator.EQUALS, group);
    }

    public static <K extends Key<K>> GroupMatcher<K> groupStartsWith(String prefix) {
        return new GroupMatcher<>(Operator.STARTS_WITH, prefix);
    }

    public static <K extends Key<K>> GroupMatcher<K> groupEndsWith(String suffix) {
        return new GroupMatcher<>(Operator.ENDS_WITH, suffix);
    }

    public static <K extends Key<K>> GroupMatcher<K> groupContains(String value) {
        return new GroupMatcher<>(Operator.CONTAINS, value);
    }

    public static <K extends Key<K>> GroupMatcher<K> anyGroup() {
        return new GroupMatcher<>(Operator.ANYTHING, "");
    }

    public static GroupMatcher<JobKey> jobGroupEquals(String group) {
        return groupEquals(group);
    }

    public static GroupMatcher<TriggerKey> triggerGroupEquals(String group) {
        return groupEquals(group);
    }

    public static GroupMatcher<JobKey> anyJobGroup() {
        return anyGroup();
    }

    public static GroupMatcher<TriggerKey> anyTriggerGroup() {
        return anyGroup();
    }

    public boolean isMatch(K key) {
        Objects.requireNonNull(key, "key");
        return operator.evaluate(key.group(), compareTo);
    }

    /**
     * Evaluates this matcher against a bare group name.
     */
    public boolean isGroupMatch(String group) {
        Objects.requireNonNull(group, "group");
        return operator.evaluate(group, compareTo);
    }

    public Operator operator() {
        return operator;
    }

    public String compareTo() {
        return compareTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupMatcher<?> that)) return false;
        return operator == that.operator && compareTo.equals(that.compareTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, compareTo);
    }

    @Override
    public String toString() {
        return "GroupMatcher[" + operator + " '" + compareTo + "']";
    }
}
