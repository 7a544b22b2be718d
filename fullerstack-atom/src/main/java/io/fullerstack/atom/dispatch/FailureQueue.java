package io.fullerstack.atom.dispatch;

import io.fullerstack.atom.ListenerFailure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of listener failures kept for later inspection.
 *
 * <p>When full, the oldest failure is dropped to make room for the newest one.
 *
 * @param <T> the value type
 */
public final class FailureQueue<T> {

    private final int capacity;
    private final Deque<ListenerFailure<T>> failures = new ArrayDeque<>();
    private long dropped;

    public FailureQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Appends a failure, evicting the oldest one if the queue is full.
     *
     * @return true if an older failure was evicted
     */
    public synchronized boolean offer(ListenerFailure<T> failure) {
        boolean evicted = false;
        if (failures.size() == capacity) {
            failures.pollFirst();
            dropped++;
            evicted = true;
        }
        failures.addLast(failure);
        return evicted;
    }

    /**
     * Removes and returns every queued failure, oldest first.
     */
    public synchronized List<ListenerFailure<T>> drain() {
        List<ListenerFailure<T>> drained = new ArrayList<>(failures);
        failures.clear();
        return drained;
    }

    public synchronized int size() {
        return failures.size();
    }

    /**
     * Total number of failures evicted since creation.
     */
    public synchronized long droppedCount() {
        return dropped;
    }

    public int capacity() {
        return capacity;
    }
}
