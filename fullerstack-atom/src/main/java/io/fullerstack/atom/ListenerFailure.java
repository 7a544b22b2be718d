package io.fullerstack.atom;

import java.util.Objects;

/**
 * A listener that threw while being notified.
 *
 * @param atomName   name of the atom that was notifying
 * @param listenerId id of the failing listener's registration
 * @param value      the value being delivered
 * @param cause      what the listener threw
 * @param <T>        the value type
 */
public record ListenerFailure<T>(String atomName, long listenerId, T value, Throwable cause) {

    public ListenerFailure {
        Objects.requireNonNull(atomName, "atomName cannot be null");
        Objects.requireNonNull(cause, "cause cannot be null");
    }
}
