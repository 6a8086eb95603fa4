package com.tinypool.core;

/**
 * Entry held by the task queue. Wraps either a user {@link Task} or the pool's
 * own shutdown signal.
 */
interface QueuedTask<R> {

    TaskOutcome<R> run() throws Exception;

    /**
     * Identifier used in log output.
     */
    String describe();

    static <R> QueuedTask<R> of(Task<? extends R> task, long sequence) {
        return new QueuedTask<>() {
            @Override
            public TaskOutcome<R> run() throws Exception {
                return TaskOutcome.of(task.execute());
            }

            @Override
            public String describe() {
                return "task-" + sequence;
            }
        };
    }

    static <R> QueuedTask<R> shutdown(int ordinal) {
        return new QueuedTask<>() {
            @Override
            public TaskOutcome<R> run() {
                return TaskOutcome.shutdown();
            }

            @Override
            public String describe() {
                return "shutdown-" + ordinal;
            }
        };
    }
}
