package io.fullerstack.atom;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A single thread-safe slot holding a value of type {@code T}, with push-based
 * change notification.
 *
 * <p>Reads take a shared lock and may run in parallel. Writes take an exclusive lock
 * only long enough to store the value and snapshot the registered listeners; listeners
 * run afterwards on the writing thread, outside the lock. A listener may therefore call
 * back into the same atom, and such calls only affect later notifications.
 *
 * <p>A write whose value is equivalent to the current one (see {@link Equivalence})
 * changes nothing and notifies nobody.
 *
 * <p>Instances are obtained from {@link Atoms}.
 *
 * @param <T> the value type
 * @see Atoms
 * @see Subscription
 */
public interface Atom<T> {

    /**
     * Returns the atom's name, used in log output and in {@link ListenerFailure} records.
     */
    String name();

    /**
     * Returns the current value (passed through the atom's copier).
     */
    T get();

    /**
     * Replaces the current value and notifies every listener registered at the time
     * of the write, unless {@code value} is equivalent to the current value.
     * The atom stores a copy of {@code value}, made with its copier; if the copy fails the
     * current value is kept.
     *
     * @param value the new value
     * @throws NullPointerException  if value is null
     * @throws IllegalStateException if called from inside an updater running on this atom
     */
    void set(T value);

    /**
     * Atomically replaces the current value with {@code updater.apply(current)}.
     *
     * <p>The updater runs while the exclusive lock is held. It must not call
     * {@link #set} or {@link #update} on the same atom and should have no side effects.
     * If it throws, the exception reaches the caller and the value is left unchanged.
     *
     * @param updater function from the current value to the new value
     * @throws NullPointerException  if updater is null or returns null
     * @throws IllegalStateException if called from inside an updater running on this atom
     */
    void update(UnaryOperator<T> updater);

    /**
     * Registers a listener for every accepted change made after this call returns.
     *
     * <p>The listener stays registered until the returned subscription is
     * {@linkplain Subscription#unsubscribe() unsubscribed} or closed.
     *
     * @param listener receives each new value
     * @return the handle responsible for the registration
     */
    Subscription subscribe(Consumer<? super T> listener);

    /**
     * Returns the number of currently registered listeners.
     */
    int listenerCount();

    /**
     * Removes and returns the listener failures kept under
     * {@link UnhandledFailurePolicy#COLLECT}, oldest first. Empty under any other policy.
     */
    List<ListenerFailure<T>> drainFailures();
}
