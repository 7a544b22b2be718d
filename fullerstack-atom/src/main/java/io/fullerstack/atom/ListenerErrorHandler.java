package io.fullerstack.atom;

/**
 * Receives listener failures for one atom.
 *
 * <p>Called on the writing thread, after the lock has been released, once per failing
 * listener. An exception thrown from here is logged and does not stop the remaining
 * listeners from being notified.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface ListenerErrorHandler<T> {

    void onListenerError(ListenerFailure<T> failure);
}
