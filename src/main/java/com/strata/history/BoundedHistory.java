package com.strata.history;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-capacity ring of recent entries. The oldest entry is evicted once the
 * capacity is reached.
 *
 * Appends come from the owning component only; readers take a snapshot without
 * locking and may observe an append in progress.
 *
 * @param <T> entry type
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final ConcurrentLinkedDeque<T> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(T entry) {
        entries.addLast(entry);
        if (size.incrementAndGet() > capacity) {
            if (entries.pollFirst() != null) {
                size.decrementAndGet();
            }
        }
    }

    /**
     * Entries oldest first.
     */
    public List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    public T latest() {
        return entries.peekLast();
    }

    public int size() {
        return Math.min(size.get(), capacity);
    }

    public int capacity() {
        return capacity;
    }
}
