package io.fullerstack.atom.cell;

import io.fullerstack.atom.Equivalence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * The shared state behind one atom: the current value, the listener registry and the
 * read/write lock guarding both.
 *
 * <p>Value and registry are only touched under the same lock, so no reader ever sees one
 * updated without the other. Every method holds the lock for its own critical section
 * only and never runs a listener.
 *
 * <p>Listener ids come from a counter that only grows; an id is never handed out twice,
 * even after its registration is removed.
 *
 * @param <T> the value type
 */
public final class StateCell<T> {

    private final ReentrantReadWriteLock lock;
    private final Lock readLock;
    private final Lock writeLock;
    private final UnaryOperator<T> copier;

    // Guarded by lock
    private final Map<Long, Registration<T>> listeners = new LinkedHashMap<>();
    private T value;
    private long nextId;

    /**
     * Creates a cell holding {@code initial}.
     *
     * @param initial  the starting value
     * @param copier   applied to every value that enters or leaves the cell
     * @param fairLock whether the lock uses fair ordering
     */
    public StateCell(T initial, UnaryOperator<T> copier, boolean fairLock) {
        Objects.requireNonNull(initial, "Initial value cannot be null");
        this.copier = Objects.requireNonNull(copier, "Copier cannot be null");
        this.value = Objects.requireNonNull(copier.apply(initial), "Copier returned null");
        this.lock = new ReentrantReadWriteLock(fairLock);
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    /**
     * Returns a copy of the current value, under the shared lock.
     */
    public T read() {
        readLock.lock();
        try {
            return copier.apply(value);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Applies {@code transition} to the current value under the exclusive lock.
     *
     * <p>If the result is equivalent to the current value nothing changes and the result is
     * empty. Otherwise the result is stored and a snapshot of the new value and the current
     * registry is returned, to be dispatched by the caller once the lock is released.
     *
     * <p>{@code transition} receives a copy of the current value. The result is copied again
     * before it is stored, so neither the transition nor the caller keeps a reference to the
     * stored value. If {@code transition} or the copier throws, the value is left as it was.
     *
     * @throws IllegalStateException if the current thread already holds the exclusive lock,
     *                               i.e. the call comes from inside another transition
     */
    public Optional<Snapshot<T>> write(UnaryOperator<T> transition, Equivalence<? super T> equivalence) {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Atom cannot be written from inside its own updater");
        }
        writeLock.lock();
        try {
            T next = Objects.requireNonNull(transition.apply(copier.apply(value)), "New value cannot be null");
            if (equivalence.equivalent(value, next)) {
                return Optional.empty();
            }
            T stored = Objects.requireNonNull(copier.apply(next), "Copier returned null");
            Snapshot<T> snapshot = new Snapshot<>(copier.apply(stored), List.copyOf(listeners.values()));
            value = stored;
            return Optional.of(snapshot);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Adds a listener under the exclusive lock.
     *
     * @return the id assigned to the registration
     */
    public long register(Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        writeLock.lock();
        try {
            long id = nextId++;
            listeners.put(id, new Registration<>(id, listener));
            return id;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes the registration with the given id, if present.
     *
     * @return true if a registration was removed
     */
    public boolean unregister(long id) {
        writeLock.lock();
        try {
            return listeners.remove(id) != null;
        } finally {
            writeLock.unlock();
        }
    }

    public int listenerCount() {
        readLock.lock();
        try {
            return listeners.size();
        } finally {
            readLock.unlock();
        }
    }
}
