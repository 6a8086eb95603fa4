package com.tinypool.config;

/**
 * Configuration for a task pool. Immutable once the pool is built.
 *
 * @param name             Pool name identifier, defaults to {@value #DEFAULT_NAME} when null or blank
 * @param workerCount      Number of worker threads
 * @param maxQueueSize     Maximum number of pending tasks
 * @param threadNamePrefix Prefix for worker thread names
 * @param daemonThreads    Whether workers are daemon threads
 */
public record PoolConfig(
        String name,
        int workerCount,
        int maxQueueSize,
        String threadNamePrefix,
        boolean daemonThreads
) {
    public static final int DEFAULT_MAX_QUEUE_SIZE = 65535;

    public static final String DEFAULT_NAME = "tiny-pool";

    public PoolConfig {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException("Max queue size must not be negative: " + maxQueueSize);
        }
        if (threadNamePrefix == null) {
            threadNamePrefix = name + "-worker-";
        }
    }

    /**
     * Hardware parallelism and the default queue size.
     */
    public static PoolConfig defaults() {
        return of(defaultWorkerCount(), DEFAULT_MAX_QUEUE_SIZE);
    }

    public static PoolConfig of(int workerCount, int maxQueueSize) {
        return new PoolConfig(DEFAULT_NAME, workerCount, maxQueueSize, null, true);
    }

    public static int defaultWorkerCount() {
        return Runtime.getRuntime().availableProcessors();
    }
}
