package com.rtcc.orchestrator.engine.persistence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Thread-safe append-only log that keeps the newest {@code capacity} entries.
 */
public class BoundedHistory<T> {

    private final Deque<T> entries = new ArrayDeque<>();
    private final int capacity;
    private long appended;

    public BoundedHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public synchronized void append(T entry) {
        entries.addLast(entry);
        appended++;
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Newest entries first.
     */
    public synchronized List<T> recent(Predicate<? super T> filter, int limit) {
        List<T> result = new ArrayList<>();
        Iterator<T> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            T entry = it.next();
            if (filter.test(entry)) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Retained entries in append order.
     */
    public synchronized List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    /**
     * Total number of entries ever appended, including evicted ones.
     */
    public synchronized long appendedCount() {
        return appended;
    }

    public synchronized int size() {
        return entries.size();
    }
}
