package io.fullerstack.atom.subscription;

import io.fullerstack.atom.Subscription;
import io.fullerstack.atom.cell.StateCell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Implementation of {@link Subscription} for one (cell, id) registration.
 *
 * <p>The cell is held through a {@link WeakReference}, so the handle never keeps an atom
 * alive. The reference is promoted to a local strong one only for the duration of a
 * removal.
 *
 * <p>Responsibility is tracked by the {@code owner} slot: whoever clears it with
 * {@code getAndSet(null)} performs the removal or the transfer, so concurrent calls to
 * {@link #unsubscribe()} and {@link #transfer()} act at most once between them.
 *
 * @param <T> the value type
 */
public final class SubscriptionImpl<T> implements Subscription {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionImpl.class);

    private static final long INERT_ID = -1L;
    private static final SubscriptionImpl<?> INERT = new SubscriptionImpl<>(null, INERT_ID);

    private final AtomicReference<WeakReference<StateCell<T>>> owner;
    private final long id;

    SubscriptionImpl(WeakReference<StateCell<T>> owner, long id) {
        this.owner = new AtomicReference<>(owner);
        this.id = id;
    }

    /**
     * Creates the handle for a registration that was just added to {@code cell}.
     *
     * @param cell the cell holding the registration
     * @param id   the registration's id
     */
    public static <T> Subscription bind(StateCell<T> cell, long id) {
        Objects.requireNonNull(cell, "Cell cannot be null");
        if (id < 0) {
            throw new IllegalArgumentException("Listener id must not be negative: " + id);
        }
        return new SubscriptionImpl<>(new WeakReference<>(cell), id);
    }

    public static Subscription inert() {
        return INERT;
    }

    @Override
    public void unsubscribe() {
        WeakReference<StateCell<T>> reference = owner.getAndSet(null);
        if (reference == null) {
            return;
        }
        StateCell<T> cell = reference.get();
        if (cell == null) {
            logger.trace("Listener {} not removed, its atom no longer exists", id);
            return;
        }
        boolean removed = cell.unregister(id);
        logger.trace("Listener {} unsubscribed (removed={})", id, removed);
    }

    @Override
    public boolean isActive() {
        WeakReference<StateCell<T>> reference = owner.get();
        return reference != null && reference.get() != null;
    }

    @Override
    public Subscription transfer() {
        WeakReference<StateCell<T>> reference = owner.getAndSet(null);
        return reference == null ? INERT : new SubscriptionImpl<>(reference, id);
    }

    long id() {
        return id;
    }

    @Override
    public String toString() {
        return isActive() ? "Subscription[id=" + id + "]" : "Subscription[inert]";
    }
}
