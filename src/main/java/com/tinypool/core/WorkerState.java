package com.tinypool.core;

/**
 * State of one worker slot as seen by {@link IdleRegistry}.
 */
public enum WorkerState {
    /** Waiting for the task queue to become non-empty. */
    WAITING,
    /** Executing a dequeued task. */
    BUSY,
    /** Consumed its shutdown signal and left the loop. */
    TERMINATED
}
