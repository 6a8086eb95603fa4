package com.tinypool.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;

/**
 * Worker thread bound to one registry slot.
 * Runs until it executes a shutdown entry; ordinary outcomes and task failures,
 * including {@link Error}s, always return it to the waiting state.
 */
final class WorkerThread<R> extends Thread {

    private static final Logger log = LoggerFactory.getLogger(WorkerThread.class);

    private final int slot;
    private final BoundedTaskQueue<QueuedTask<R>> taskQueue;
    private final ResultQueue<R> resultQueue;
    private final IdleRegistry registry;
    private final Semaphore exitConfirmations;

    WorkerThread(
            int slot,
            String name,
            boolean daemon,
            BoundedTaskQueue<QueuedTask<R>> taskQueue,
            ResultQueue<R> resultQueue,
            IdleRegistry registry,
            Semaphore exitConfirmations
    ) {
        super(name);
        this.slot = slot;
        this.taskQueue = taskQueue;
        this.resultQueue = resultQueue;
        this.registry = registry;
        this.exitConfirmations = exitConfirmations;
        setDaemon(daemon);
    }

    @Override
    public void run() {
        registry.markWaiting(slot);
        log.debug("Worker {} started", getName());

        while (true) {
            QueuedTask<R> task = taskQueue.take(() -> registry.markBusy(slot));
            log.trace("Worker {} executing {}", getName(), task.describe());

            TaskOutcome<R> outcome = execute(task);
            if (outcome.isShutdown()) {
                registry.markTerminated(slot);
                exitConfirmations.release();
                break;
            }
            if (outcome.kind() == TaskOutcome.Kind.RESULT) {
                resultQueue.add(outcome.value());
            }
            registry.markWaiting(slot);
        }

        log.debug("Worker {} stopped", getName());
    }

    private TaskOutcome<R> execute(QueuedTask<R> task) {
        try {
            return task.run();
        } catch (Throwable e) {
            // Any failure, Errors included, must leave the worker alive to consume its shutdown entry.
            log.error("Worker {} task {} failed: {}", getName(), task.describe(), e.getMessage(), e);
            return TaskOutcome.empty();
        }
    }
}
