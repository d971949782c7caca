package com.phillippitts.compressorwatch.service.monitoring;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Fixed-capacity FIFO ring of records. When full, each {@link #add} evicts the oldest entry.
 * Thread-safe.
 *
 * @param <T> record type
 */
public final class BoundedRingBuffer<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void add(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(item);
    }

    /**
     * Returns up to {@code limit} of the most recent entries, oldest first.
     *
     * @param limit maximum number of entries; values &lt;= 0 yield an empty list
     * @return unmodifiable copy
     */
    public synchronized List<T> lastN(int limit) {
        int n = Math.min(Math.max(limit, 0), entries.size());
        if (n == 0) {
            return List.of();
        }
        List<T> out = new ArrayList<>(n);
        Iterator<T> newestFirst = entries.descendingIterator();
        for (int i = 0; i < n; i++) {
            out.add(newestFirst.next());
        }
        Collections.reverse(out);
        return Collections.unmodifiableList(out);
    }

    /**
     * @return every stored entry, oldest first
     */
    public synchronized List<T> snapshot() {
        return lastN(entries.size());
    }

    public synchronized void clear() {
        entries.clear();
    }
}
