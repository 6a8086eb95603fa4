package com.tinypool.core;

import com.tinypool.config.PoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of TaskPool.
 * Starts every worker up front and keeps them until {@link #close()}.
 */
public class DefaultTaskPool<R> implements TaskPool<R> {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskPool.class);

    private final PoolConfig config;
    private final BoundedTaskQueue<QueuedTask<R>> taskQueue;
    private final ResultQueue<R> resultQueue = new ResultQueue<>();
    private final IdleRegistry registry;
    private final List<WorkerThread<R>> workers;
    private final Semaphore exitConfirmations = new Semaphore(0);

    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong(0);
    private final Object closeMonitor = new Object();

    public DefaultTaskPool() {
        this(PoolConfig.defaults());
    }

    public DefaultTaskPool(int workerCount) {
        this(PoolConfig.of(workerCount, PoolConfig.DEFAULT_MAX_QUEUE_SIZE));
    }

    public DefaultTaskPool(int workerCount, int maxQueueSize) {
        this(PoolConfig.of(workerCount, maxQueueSize));
    }

    public DefaultTaskPool(PoolConfig config) {
        if (config == null) {
            throw new NullPointerException("Config cannot be null");
        }
        this.config = config;
        this.taskQueue = new BoundedTaskQueue<>(config.maxQueueSize());
        this.registry = new IdleRegistry(config.workerCount());

        List<WorkerThread<R>> started = new ArrayList<>(config.workerCount());
        for (int slot = 0; slot < config.workerCount(); slot++) {
            WorkerThread<R> worker = new WorkerThread<>(
                    slot,
                    config.threadNamePrefix() + slot,
                    config.daemonThreads(),
                    taskQueue,
                    resultQueue,
                    registry,
                    exitConfirmations
            );
            started.add(worker);
            worker.start();
        }
        this.workers = Collections.unmodifiableList(started);

        log.info("TaskPool initialized: {} (workers={}, maxQueueSize={})",
                config.name(), config.workerCount(), config.maxQueueSize());
    }

    @Override
    public boolean submit(Task<? extends R> task) {
        if (task == null) {
            throw new NullPointerException("Task cannot be null");
        }
        if (closing.get()) {
            log.warn("Pool {} is closing, rejecting task", config.name());
            return false;
        }

        QueuedTask<R> entry = QueuedTask.of(task, sequence.incrementAndGet());
        if (!taskQueue.offer(entry)) {
            if (taskQueue.isShutdown()) {
                log.warn("Pool {} is closing, rejecting {}", config.name(), entry.describe());
            } else {
                log.debug("Queue full ({}), rejecting {}", config.maxQueueSize(), entry.describe());
            }
            return false;
        }
        log.trace("{} enqueued (queue size: {})", entry.describe(), taskQueue.size());
        return true;
    }

    @Override
    public List<R> collectAll() {
        return resultQueue.drain();
    }

    @Override
    public int getIdleThreadsCount() {
        return registry.idleCount();
    }

    @Override
    public int getWaitingQueueCount() {
        return taskQueue.size();
    }

    @Override
    public int getResultsCount() {
        return resultQueue.size();
    }

    @Override
    public int getWorkerCount() {
        return config.workerCount();
    }

    @Override
    public int getMaxQueueSize() {
        return config.maxQueueSize();
    }

    /**
     * State of a single worker slot.
     */
    public WorkerState getWorkerState(int slot) {
        return registry.stateOf(slot);
    }

    /**
     * Number of workers that have consumed their shutdown signal.
     */
    public int getTerminatedCount() {
        return registry.terminatedCount();
    }

    public PoolConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        synchronized (closeMonitor) {
            if (closed.get()) {
                return;
            }
            closing.set(true);
            // Under the queue lock: no offer can slip in once the shutdown entries are queued.
            taskQueue.shutdown();
            log.info("Closing TaskPool: {} ({} tasks still queued)", config.name(), taskQueue.size());

            // One signal at a time: each must be consumed before the next is queued.
            for (int i = 0; i < workers.size(); i++) {
                taskQueue.put(QueuedTask.shutdown(i + 1));
                exitConfirmations.acquireUninterruptibly();
                log.debug("Worker exit confirmed ({}/{})", i + 1, workers.size());
            }

            for (WorkerThread<R> worker : workers) {
                joinQuietly(worker);
            }
            closed.set(true);
            log.info("TaskPool closed: {}", config.name());
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    private void joinQuietly(WorkerThread<R> worker) {
        boolean interrupted = false;
        while (worker.isAlive()) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
