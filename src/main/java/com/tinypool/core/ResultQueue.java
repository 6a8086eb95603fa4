package com.tinypool.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates results in completion order until drained.
 *
 * @param <R> Result type
 */
public class ResultQueue<R> {

    private final Deque<R> results = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public void add(R result) {
        if (result == null) {
            throw new NullPointerException("Result cannot be null");
        }
        lock.lock();
        try {
            results.addLast(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every queued result, oldest first.
     * Returns an empty list when nothing is queued.
     */
    public List<R> drain() {
        lock.lock();
        try {
            List<R> drained = new ArrayList<>(results);
            results.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return results.size();
        } finally {
            lock.unlock();
        }
    }
}
