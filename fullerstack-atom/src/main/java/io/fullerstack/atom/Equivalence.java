package io.fullerstack.atom;

import java.util.Objects;

/**
 * Decides whether a write is a change. A write whose value is equivalent to the
 * current one is suppressed: no mutation, no notification.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface Equivalence<T> {

    boolean equivalent(T current, T candidate);

    /**
     * {@link Objects#equals(Object, Object)}. The default for every atom.
     */
    static <T> Equivalence<T> natural() {
        return Objects::equals;
    }

    /**
     * Reference equality.
     */
    static <T> Equivalence<T> identity() {
        return (current, candidate) -> current == candidate;
    }

    /**
     * Nothing is equivalent; every write notifies.
     */
    static <T> Equivalence<T> never() {
        return (current, candidate) -> false;
    }
}
