package com.tinypool.core;

import java.util.Optional;

/**
 * Unit of work accepted by a {@link TaskPool}.
 * <p>
 * A task is executed exactly once by exactly one worker. The pool does not bound
 * execution time: a task that never returns keeps its worker busy for the lifetime
 * of the pool.
 *
 * @param <R> Result type
 */
@FunctionalInterface
public interface Task<R> {

    /**
     * Perform the work.
     *
     * @return the result, or empty if the task produces nothing worth collecting
     * @throws Exception if the work fails; the worker logs any failure, {@link Error}s included,
     *                   and treats it as an empty result
     */
    Optional<R> execute() throws Exception;
}
