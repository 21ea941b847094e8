package com.questrail.tracker.protocol.suntech.internal.history;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;

/**
 * BoundedHistory
 * -----------------------------------------------------------------------------
 * Append-only FIFO store capped at a fixed capacity. Appending to a full store
 * evicts the oldest element first.
 *
 * <p>Not thread-safe. The aggregator guards every instance with its lock.</p>
 *
 * @param <T> element type
 */
public final class BoundedHistory<T>
{
    private final int capacity;
    private final ArrayDeque<T> elements;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(T element) {
        Objects.requireNonNull(element, "element");
        if (elements.size() == capacity) {
            elements.removeFirst();
        }
        elements.addLast(element);
    }

    public void appendAll(List<? extends T> batch) {
        for (T element : batch) {
            append(element);
        }
    }

    /**
     * Returns an immutable copy, oldest first.
     */
    public List<T> snapshot() {
        return List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }
}
