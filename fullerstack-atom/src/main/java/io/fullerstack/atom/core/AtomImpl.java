package io.fullerstack.atom.core;

import io.fullerstack.atom.Atom;
import io.fullerstack.atom.Equivalence;
import io.fullerstack.atom.ListenerErrorHandler;
import io.fullerstack.atom.ListenerFailure;
import io.fullerstack.atom.Subscription;
import io.fullerstack.atom.cell.Snapshot;
import io.fullerstack.atom.cell.StateCell;
import io.fullerstack.atom.config.AtomSettings;
import io.fullerstack.atom.dispatch.NotificationDispatcher;
import io.fullerstack.atom.subscription.SubscriptionImpl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Implementation of {@link Atom}.
 *
 * <p>Owns a {@link StateCell} (value, registry, lock) and a {@link NotificationDispatcher}.
 * Every write follows the same sequence:
 * <ol>
 *   <li>Under the exclusive lock: compute the new value, drop it if equivalent to the
 *       current one, otherwise store it and snapshot value and registry</li>
 *   <li>Release the lock</li>
 *   <li>Dispatch the snapshot on the calling thread</li>
 * </ol>
 *
 * <p>Subscriptions hold the cell weakly, so they never extend the atom's life.
 *
 * <p>Obtain instances through {@link io.fullerstack.atom.Atoms}.
 *
 * @param <T> the value type
 */
public final class AtomImpl<T> implements Atom<T> {

    private static final Logger logger = LoggerFactory.getLogger(AtomImpl.class);

    private final String name;
    private final StateCell<T> cell;
    private final Equivalence<? super T> equivalence;
    private final NotificationDispatcher<T> dispatcher;

    public AtomImpl(String name,
                    T initial,
                    ListenerErrorHandler<T> errorHandler,
                    Equivalence<? super T> equivalence,
                    UnaryOperator<T> copier,
                    AtomSettings settings) {
        this.name = Objects.requireNonNull(name, "Atom name cannot be null");
        this.equivalence = Objects.requireNonNull(equivalence, "Equivalence cannot be null");
        Objects.requireNonNull(settings, "Settings cannot be null");
        this.cell = new StateCell<>(initial, copier, settings.isFairLock());
        this.dispatcher = new NotificationDispatcher<>(
            name,
            errorHandler,
            settings.getUnhandledFailurePolicy(),
            settings.getFailureCapacity()
        );
        logger.debug("Created atom '{}' with {} (error handler: {})",
            name, settings, errorHandler != null);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public T get() {
        return cell.read();
    }

    @Override
    public void set(T value) {
        Objects.requireNonNull(value, "Value cannot be null");
        write(current -> value);
    }

    @Override
    public void update(UnaryOperator<T> updater) {
        Objects.requireNonNull(updater, "Updater cannot be null");
        write(current -> Objects.requireNonNull(updater.apply(current), "Updater returned null"));
    }

    private void write(UnaryOperator<T> transition) {
        Optional<Snapshot<T>> snapshot = cell.write(transition, equivalence);
        if (snapshot.isEmpty()) {
            logger.trace("Atom '{}' write suppressed, value unchanged", name);
            return;
        }
        dispatcher.dispatch(snapshot.get());
    }

    @Override
    public Subscription subscribe(Consumer<? super T> listener) {
        long id = cell.register(listener);
        logger.trace("Atom '{}' registered listener {}", name, id);
        return SubscriptionImpl.bind(cell, id);
    }

    @Override
    public int listenerCount() {
        return cell.listenerCount();
    }

    @Override
    public List<ListenerFailure<T>> drainFailures() {
        return dispatcher.drainFailures();
    }

    @Override
    public String toString() {
        return "Atom[" + name + "]";
    }
}
