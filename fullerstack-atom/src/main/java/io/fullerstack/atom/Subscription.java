package io.fullerstack.atom;

import io.fullerstack.atom.subscription.SubscriptionImpl;

/**
 * Handle for one listener registration on an {@link Atom}.
 *
 * <p>Exactly one handle is responsible for a registration at any time. The registration
 * is removed when that handle is {@linkplain #unsubscribe() unsubscribed} or closed;
 * a try-with-resources block removes it at the end of the block:
 *
 * <pre>
 * try (Subscription sub = atom.subscribe(v -&gt; log.info("now {}", v))) {
 *     atom.set(42);
 * }
 * </pre>
 *
 * <p>The handle does not keep the atom alive. Once the atom is gone every operation
 * on the handle is a no-op.
 *
 * @see SubscriptionSlot
 */
public interface Subscription extends AutoCloseable {

    /**
     * Removes the registration if this handle still owns it and the atom is still alive,
     * then makes the handle inert. Safe to call any number of times from any thread.
     */
    void unsubscribe();

    /**
     * Returns true while this handle owns a registration.
     */
    boolean isActive();

    /**
     * Moves responsibility for the registration to a new handle.
     *
     * <p>The registration itself is untouched; this handle becomes inert. Transferring
     * an inert handle returns another inert handle.
     *
     * @return the handle now responsible for the registration
     */
    Subscription transfer();

    /**
     * Same as {@link #unsubscribe()}.
     */
    @Override
    default void close() {
        unsubscribe();
    }

    /**
     * Returns a handle that owns no registration.
     */
    static Subscription inert() {
        return SubscriptionImpl.inert();
    }
}
