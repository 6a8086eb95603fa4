package com.tinypool.task;

import com.tinypool.config.PoolConfig;
import com.tinypool.core.DefaultTaskPool;
import com.tinypool.exception.PoolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Feeds {@link TimeoutTask}s into a backing pool only as fast as workers free up.
 * <p>
 * A dispatching loop runs as a task on the backing pool, so the pool gets one extra
 * worker for it. Each round the loop counts every pending task down, then moves at
 * most {@link DefaultTaskPool#getIdleThreadsCount()} pending tasks into the pool, oldest first.
 * Tasks already handed to the pool are never timed out or cancelled.
 *
 * @param <R> Result type
 */
public class TimeoutDispatcher<R> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutDispatcher.class);

    private final DefaultTaskPool<R> pool;
    private final long roundNanos;
    private final Deque<TimeoutTask<? extends R>> pending = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final Condition closeRequested = lock.newCondition();
    private volatile boolean closing;

    /**
     * @param workerCount Workers available to timeout tasks
     * @param round       Length of one dispatch round
     * @param unit        Unit of {@code round}
     */
    public TimeoutDispatcher(int workerCount, long round, TimeUnit unit) {
        if (round <= 0) {
            throw new IllegalArgumentException("Round must be positive: " + round);
        }
        this.roundNanos = unit.toNanos(round);
        this.pool = new DefaultTaskPool<>(new PoolConfig(
                "timeout-pool", workerCount + 1, PoolConfig.DEFAULT_MAX_QUEUE_SIZE, null, true));
        if (!pool.submit(this::dispatchLoop)) {
            pool.close();
            throw new PoolException("Could not start dispatch loop");
        }
        log.info("TimeoutDispatcher started (workers={}, round={}ms)",
                workerCount, TimeUnit.NANOSECONDS.toMillis(roundNanos));
    }

    /**
     * Add a task to the pending list.
     *
     * @return false if the dispatcher is closing
     */
    public boolean submit(TimeoutTask<? extends R> task) {
        if (task == null) {
            throw new NullPointerException("Task cannot be null");
        }
        lock.lock();
        try {
            if (closing) {
                return false;
            }
            pending.addLast(task);
            workAvailable.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public List<R> collectAll() {
        return pool.collectAll();
    }

    public int getPendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop dispatching and close the backing pool.
     * Tasks still pending are dropped; tasks already in the pool run to completion.
     */
    @Override
    public void close() {
        int dropped;
        lock.lock();
        try {
            if (closing) {
                return;
            }
            closing = true;
            dropped = pending.size();
            pending.clear();
            workAvailable.signalAll();
            closeRequested.signalAll();
        } finally {
            lock.unlock();
        }
        if (dropped > 0) {
            log.warn("TimeoutDispatcher closing, dropping {} pending tasks", dropped);
        }
        pool.close();
    }

    private Optional<R> dispatchLoop() {
        lock.lock();
        try {
            while (!closing) {
                if (pending.isEmpty()) {
                    workAvailable.await();
                    continue;
                }
                runRound();
                long nanos = roundNanos;
                while (nanos > 0 && !closing) {
                    nanos = closeRequested.awaitNanos(nanos);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatch loop interrupted, {} tasks left pending", pending.size());
        } finally {
            lock.unlock();
        }
        return Optional.empty();
    }

    private void runRound() {
        for (TimeoutTask<? extends R> task : pending) {
            task.countDown();
        }
        int idle = pool.getIdleThreadsCount();
        int dispatched = 0;
        while (idle-- > 0 && !pending.isEmpty()) {
            if (!pool.submit(pending.peekFirst())) {
                break;
            }
            pending.removeFirst();
            dispatched++;
        }
        log.trace("Dispatch round: {} dispatched, {} pending", dispatched, pending.size());
    }
}
