package io.fullerstack.atom.cell;

import java.util.List;
import java.util.Objects;

/**
 * The value written and the listeners registered at the moment of an accepted write,
 * captured together under the exclusive lock.
 *
 * @param value         the value to deliver
 * @param registrations immutable copy of the registry
 * @param <T>           the value type
 */
public record Snapshot<T>(T value, List<Registration<T>> registrations) {

    public Snapshot {
        Objects.requireNonNull(value, "Value cannot be null");
        registrations = List.copyOf(registrations);
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }
}
