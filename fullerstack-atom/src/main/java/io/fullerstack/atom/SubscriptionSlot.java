package io.fullerstack.atom;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds at most one {@link Subscription} and unsubscribes it when it is replaced.
 *
 * <p>Useful for fields that are re-pointed at a new registration over time:
 *
 * <pre>
 * SubscriptionSlot slot = new SubscriptionSlot();
 * slot.replace(atom.subscribe(first));
 * slot.replace(atom.subscribe(second));  // first is unsubscribed here
 * slot.close();                          // second is unsubscribed here
 * </pre>
 *
 * <p>The slot takes ownership of each subscription it is given.
 */
public final class SubscriptionSlot implements AutoCloseable {

    private final AtomicReference<Subscription> current =
        new AtomicReference<>(Subscription.inert());

    public SubscriptionSlot() {
    }

    public SubscriptionSlot(Subscription initial) {
        replace(initial);
    }

    /**
     * Unsubscribes the held subscription and holds {@code next} instead.
     * Replacing a subscription with itself does nothing.
     *
     * @param next the subscription to take ownership of
     */
    public void replace(Subscription next) {
        Objects.requireNonNull(next, "Subscription cannot be null");
        Subscription previous = current.getAndSet(next);
        if (previous != next) {
            previous.unsubscribe();
        }
    }

    /**
     * Returns the held subscription, which may be inert.
     */
    public Subscription get() {
        return current.get();
    }

    /**
     * Gives up ownership of the held subscription without unsubscribing it.
     *
     * @return the subscription that was held
     */
    public Subscription release() {
        return current.getAndSet(Subscription.inert());
    }

    @Override
    public void close() {
        current.getAndSet(Subscription.inert()).unsubscribe();
    }
}
