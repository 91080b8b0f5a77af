package com.rtcc.orchestrator.engine.kernel;

import com.rtcc.orchestrator.core.model.OrchestrationAction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded priority queue of pending actions.
 *
 * Lower priority numbers are served first; within a priority band actions leave in
 * enqueue order. When full, the entry with the highest priority number and the latest
 * enqueue is shed, which may be the action being offered.
 */
public class ActionQueue {

    /**
     * A queued action with its enqueue sequence.
     */
    public record Entry(OrchestrationAction action, long sequence) {}

    private static final Comparator<Entry> ORDER = Comparator
        .comparingInt((Entry e) -> e.action().priority())
        .thenComparingLong(Entry::sequence);

    private final int capacity;
    private final PriorityQueue<Entry> entries = new PriorityQueue<>(ORDER);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private long nextSequence;

    public ActionQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    /**
     * Enqueue an action.
     *
     * @return The action shed to make room, if the queue was full
     */
    public Optional<OrchestrationAction> offer(OrchestrationAction action) {
        lock.lock();
        try {
            Entry entry = new Entry(action, nextSequence++);
            if (entries.size() < capacity) {
                entries.add(entry);
                notEmpty.signal();
                return Optional.empty();
            }
            Entry worst = entry;
            for (Entry candidate : entries) {
                if (ORDER.compare(candidate, worst) > 0) {
                    worst = candidate;
                }
            }
            if (worst != entry) {
                entries.remove(worst);
                entries.add(entry);
                notEmpty.signal();
            }
            return Optional.of(worst.action());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put back an entry taken by {@link #poll}, keeping its place in the band.
     */
    public void restore(Entry entry) {
        lock.lock();
        try {
            entries.add(entry);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the head, waiting up to the given time for one to arrive.
     *
     * @return The head entry, or null on timeout
     */
    public Entry poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return entries.poll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every queued action matching the filter.
     */
    public List<OrchestrationAction> removeIf(Predicate<OrchestrationAction> filter) {
        lock.lock();
        try {
            List<OrchestrationAction> removed = new ArrayList<>();
            Iterator<Entry> it = entries.iterator();
            while (it.hasNext()) {
                Entry entry = it.next();
                if (filter.test(entry.action())) {
                    removed.add(entry.action());
                    it.remove();
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queued actions in dispatch order.
     */
    public List<OrchestrationAction> snapshot() {
        lock.lock();
        try {
            List<Entry> ordered = new ArrayList<>(entries);
            ordered.sort(ORDER);
            return ordered.stream().map(Entry::action).toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
