package com.tinypool.core;

import java.util.List;

/**
 * Fixed-size pool of worker threads.
 * <p>
 * Submission is non-blocking and reports a full queue through its return value.
 * Results of completed tasks are kept until collected with {@link #collectAll()}.
 * Closing the pool waits until every worker has stopped.
 *
 * @param <R> Result type
 */
public interface TaskPool<R> extends AutoCloseable {

    /**
     * Queue a task for execution.
     *
     * @param task The task to run
     * @return true if queued, false if the queue is full or the pool is closing
     * @throws NullPointerException if task is null
     */
    boolean submit(Task<? extends R> task);

    /**
     * Drain every result collected so far, in completion order.
     *
     * @return collected results, empty if there are none
     */
    List<R> collectAll();

    /**
     * Number of workers currently waiting for work.
     * A snapshot; it may be stale by the time the caller reads it.
     */
    int getIdleThreadsCount();

    /**
     * Number of tasks waiting in the queue.
     */
    int getWaitingQueueCount();

    /**
     * Number of results waiting to be collected.
     */
    int getResultsCount();

    int getWorkerCount();

    int getMaxQueueSize();

    /**
     * Stop every worker, one at a time, blocking until each has confirmed its exit.
     * Tasks queued before the call still run first. Calling this from a task running
     * on the same pool never returns.
     */
    @Override
    void close();

    boolean isClosed();
}
