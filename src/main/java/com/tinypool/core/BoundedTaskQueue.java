package com.tinypool.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of pending entries with a fixed capacity.
 * <p>
 * {@link #offer(Object)} never blocks: it rejects once the queue holds
 * {@code capacity} entries, or once {@link #shutdown()} has been called.
 * A capacity of zero rejects every offer.
 *
 * @param <T> Entry type
 */
public class BoundedTaskQueue<T> {

    private final int capacity;
    private final Deque<T> entries = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean shutdown;

    public BoundedTaskQueue(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append an entry unless the queue is full.
     *
     * @return true if appended, false if the queue is full or shut down
     */
    public boolean offer(T entry) {
        if (entry == null) {
            throw new NullPointerException("Entry cannot be null");
        }
        lock.lock();
        try {
            if (shutdown || entries.size() >= capacity) {
                return false;
            }
            entries.addLast(entry);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuse every later {@link #offer(Object)}. Entries already queued stay queued,
     * and {@link #put(Object)} keeps working.
     */
    void shutdown() {
        lock.lock();
        try {
            shutdown = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append an entry, waiting for room if necessary. Ignores {@link #shutdown()}.
     * Room is measured against {@code max(capacity, 1)} so that a zero-capacity
     * queue still admits one entry at a time through this path.
     */
    void put(T entry) {
        if (entry == null) {
            throw new NullPointerException("Entry cannot be null");
        }
        int bound = Math.max(capacity, 1);
        lock.lock();
        try {
            while (entries.size() >= bound) {
                notFull.awaitUninterruptibly();
            }
            entries.addLast(entry);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the head entry, waiting while the queue is empty.
     * {@code onDequeue} runs while the queue lock is still held, just before the
     * head is removed, so that observers never see an entry that is neither queued
     * nor claimed.
     */
    T take(Runnable onDequeue) {
        lock.lock();
        try {
            while (entries.isEmpty()) {
                notEmpty.awaitUninterruptibly();
            }
            onDequeue.run();
            T head = entries.removeFirst();
            notFull.signal();
            return head;
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
