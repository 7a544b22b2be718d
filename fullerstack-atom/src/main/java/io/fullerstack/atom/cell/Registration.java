package io.fullerstack.atom.cell;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A listener together with the id it was registered under.
 *
 * @param id       unique within one cell, never reused
 * @param listener the callback
 * @param <T>      the value type
 */
public record Registration<T>(long id, Consumer<? super T> listener) {

    public Registration {
        Objects.requireNonNull(listener, "Listener cannot be null");
    }
}
