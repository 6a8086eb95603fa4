package com.tinypool.core;

import com.tinypool.config.PoolConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultTaskPool.
 */
class DefaultTaskPoolTest {

    private DefaultTaskPool<Integer> pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    // =====================================================================
    // Construction
    // =====================================================================

    @Test
    @DisplayName("Default construction uses hardware parallelism and 65535 capacity")
    void defaultConstruction() {
        pool = new DefaultTaskPool<>();

        assertEquals(Runtime.getRuntime().availableProcessors(), pool.getWorkerCount());
        assertEquals(65535, pool.getMaxQueueSize());
    }

    @Test
    @DisplayName("Every worker starts idle")
    void workersStartIdle() {
        pool = new DefaultTaskPool<>(4, 10);

        assertEquals(4, pool.getIdleThreadsCount());
        assertEquals(0, pool.getWaitingQueueCount());
        assertEquals(0, pool.getResultsCount());
        for (int slot = 0; slot < 4; slot++) {
            assertEquals(WorkerState.WAITING, pool.getWorkerState(slot));
        }
    }

    @Test
    @DisplayName("Reject invalid worker count and capacity")
    void rejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultTaskPool<Integer>(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new DefaultTaskPool<Integer>(2, -1));
    }

    @Test
    @DisplayName("Worker threads carry the configured name prefix")
    void workerThreadNames() throws Exception {
        pool = new DefaultTaskPool<>(new PoolConfig("named", 1, 10, "named-worker-", true));
        List<String> names = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        assertTrue(pool.submit(() -> {
            names.add(Thread.currentThread().getName());
            done.countDown();
            return Optional.empty();
        }));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("named-worker-0"), names);
    }

    // =====================================================================
    // Submission and collection
    // =====================================================================

    @Test
    @DisplayName("Two workers, capacity five: three delayed tasks all report their ids")
    void threeTasksOnTwoWorkers() throws Exception {
        pool = new DefaultTaskPool<>(2, 5);

        for (int id = 1; id <= 3; id++) {
            int taskId = id;
            assertTrue(pool.submit(() -> {
                Thread.sleep(50);
                return Optional.of(taskId);
            }));
        }

        List<Integer> results = awaitResults(pool, 3, Duration.ofSeconds(5));
        assertEquals(Set.of(1, 2, 3), new HashSet<>(results));
        assertEquals(0, pool.getWaitingQueueCount());
    }

    @Test
    @DisplayName("Every submitted task runs exactly once")
    void everyTaskRunsOnce() throws Exception {
        pool = new DefaultTaskPool<>(4, 1000);
        int taskCount = 500;
        AtomicInteger executions = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            int taskId = i;
            assertTrue(pool.submit(() -> {
                executions.incrementAndGet();
                return Optional.of(taskId);
            }));
        }

        List<Integer> results = awaitResults(pool, taskCount, Duration.ofSeconds(10));
        assertEquals(taskCount, results.size());
        assertEquals(taskCount, new HashSet<>(results).size());
        assertEquals(taskCount, executions.get());
    }

    @Test
    @DisplayName("Concurrent submitters never lose or duplicate tasks")
    void concurrentSubmitters() throws Exception {
        pool = new DefaultTaskPool<>(3, 65535);
        int threads = 4;
        int perThread = 250;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> submitters = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int base = t * perThread;
            Thread submitter = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    int taskId = base + i;
                    pool.submit(() -> Optional.of(taskId));
                }
            });
            submitters.add(submitter);
            submitter.start();
        }
        start.countDown();
        for (Thread submitter : submitters) {
            submitter.join(5000);
        }

        List<Integer> results = awaitResults(pool, threads * perThread, Duration.ofSeconds(10));
        assertEquals(threads * perThread, new HashSet<>(results).size());
    }

    @Test
    @DisplayName("Empty results are never collected")
    void emptyResultsDiscarded() throws Exception {
        pool = new DefaultTaskPool<>(2, 10);
        CountDownLatch done = new CountDownLatch(3);

        pool.submit(() -> {
            done.countDown();
            return Optional.empty();
        });
        pool.submit(() -> {
            done.countDown();
            return null;
        });
        pool.submit(() -> {
            done.countDown();
            return Optional.of(7);
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        List<Integer> results = awaitResults(pool, 1, Duration.ofSeconds(5));
        Thread.sleep(50);
        results.addAll(pool.collectAll());
        assertEquals(List.of(7), results);
    }

    @Test
    @DisplayName("Collecting twice in a row returns nothing the second time")
    void drainIsIdempotent() throws Exception {
        pool = new DefaultTaskPool<>(2, 10);
        pool.submit(() -> Optional.of(1));
        pool.submit(() -> Optional.of(2));

        awaitResultsCount(pool, 2, Duration.ofSeconds(5));
        assertEquals(2, pool.getResultsCount());
        assertEquals(2, pool.collectAll().size());
        assertTrue(pool.collectAll().isEmpty());
        assertEquals(0, pool.getResultsCount());
    }

    @Test
    @DisplayName("Reject null task")
    void rejectNullTask() {
        pool = new DefaultTaskPool<>(1, 1);
        assertThrows(NullPointerException.class, () -> pool.submit(null));
    }

    // =====================================================================
    // Capacity
    // =====================================================================

    @Test
    @DisplayName("Zero capacity rejects every submission")
    void zeroCapacityAlwaysFull() {
        pool = new DefaultTaskPool<>(2, 0);

        assertFalse(pool.submit(() -> Optional.of(1)));
        assertFalse(pool.submit(() -> Optional.of(2)));
        assertEquals(0, pool.getWaitingQueueCount());
    }

    @Test
    @DisplayName("One worker, capacity one: the queue fills while the worker is busy")
    void singleSlotQueueFills() throws Exception {
        pool = new DefaultTaskPool<>(1, 1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        assertTrue(pool.submit(() -> {
            started.countDown();
            release.await();
            return Optional.of(1);
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(0, pool.getIdleThreadsCount());

        assertTrue(pool.submit(() -> Optional.of(2)));
        assertFalse(pool.submit(() -> Optional.of(3)));
        assertEquals(1, pool.getWaitingQueueCount());

        release.countDown();
        List<Integer> results = awaitResults(pool, 2, Duration.ofSeconds(5));
        assertEquals(List.of(1, 2), results);
    }

    @Test
    @DisplayName("Queue length never exceeds capacity under a submission burst")
    void queueNeverExceedsCapacity() throws Exception {
        pool = new DefaultTaskPool<>(1, 3);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        pool.submit(() -> {
            started.countDown();
            release.await();
            return Optional.empty();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        int accepted = 0;
        for (int i = 0; i < 20; i++) {
            if (pool.submit(() -> Optional.empty())) {
                accepted++;
            }
            assertTrue(pool.getWaitingQueueCount() <= 3);
        }
        assertEquals(3, accepted);
        release.countDown();
    }

    // =====================================================================
    // Idle accounting and failures
    // =====================================================================

    @Test
    @DisplayName("Idle plus busy workers never exceed the worker count")
    void noOverCommitment() throws Exception {
        pool = new DefaultTaskPool<>(3, 100);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);

        for (int i = 0; i < 2; i++) {
            pool.submit(() -> {
                started.countDown();
                release.await();
                return Optional.empty();
            });
        }
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(1, pool.getIdleThreadsCount());
        int busy = 0;
        for (int slot = 0; slot < 3; slot++) {
            if (pool.getWorkerState(slot) == WorkerState.BUSY) {
                busy++;
            }
        }
        assertEquals(2, busy);
        assertTrue(pool.getIdleThreadsCount() + busy <= pool.getWorkerCount());

        release.countDown();
        awaitIdle(pool, 3, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A failing task does not stop its worker")
    void failingTaskKeepsWorker() throws Exception {
        pool = new DefaultTaskPool<>(1, 10);

        pool.submit(() -> {
            throw new IllegalStateException("boom");
        });
        pool.submit(() -> Optional.of(42));

        assertEquals(List.of(42), awaitResults(pool, 1, Duration.ofSeconds(5)));
        awaitIdle(pool, 1, Duration.ofSeconds(5));
        assertEquals(WorkerState.WAITING, pool.getWorkerState(0));
    }

    @Test
    @DisplayName("A task throwing an Error does not stop its worker or block close")
    void errorInTaskKeepsWorker() throws Exception {
        pool = new DefaultTaskPool<>(2, 10);

        pool.submit(() -> {
            throw new AssertionError("fatal");
        });
        pool.submit(() -> Optional.of(1));
        pool.submit(() -> Optional.of(2));

        List<Integer> results = awaitResults(pool, 2, Duration.ofSeconds(5));
        assertEquals(Set.of(1, 2), new HashSet<>(results));
        awaitIdle(pool, 2, Duration.ofSeconds(5));

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> pool.close());
        assertEquals(2, pool.getTerminatedCount());
    }

    // =====================================================================
    // Close
    // =====================================================================

    @Test
    @DisplayName("Closing an unused pool completes promptly")
    void closeUnusedPool() {
        pool = new DefaultTaskPool<>(8, 65535);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> pool.close());
        assertTrue(pool.isClosed());
        assertEquals(8, pool.getTerminatedCount());
        assertEquals(0, pool.getIdleThreadsCount());
    }

    @Test
    @DisplayName("Close works when capacity is smaller than the worker count")
    void closeWithSmallCapacity() {
        DefaultTaskPool<Integer> zero = new DefaultTaskPool<>(3, 0);
        DefaultTaskPool<Integer> one = new DefaultTaskPool<>(4, 1);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            zero.close();
            one.close();
        });
        assertTrue(zero.isClosed());
        assertTrue(one.isClosed());
    }

    @Test
    @DisplayName("Tasks queued before close still run and their results stay collectable")
    void closeRunsQueuedTasks() {
        pool = new DefaultTaskPool<>(1, 10);
        for (int i = 1; i <= 5; i++) {
            int taskId = i;
            pool.submit(() -> {
                Thread.sleep(10);
                return Optional.of(taskId);
            });
        }

        pool.close();

        assertEquals(List.of(1, 2, 3, 4, 5), pool.collectAll());
        for (int slot = 0; slot < pool.getWorkerCount(); slot++) {
            assertEquals(WorkerState.TERMINATED, pool.getWorkerState(slot));
        }
    }

    @Test
    @DisplayName("Submitting to a closed pool fails and close is idempotent")
    void submitAfterClose() {
        pool = new DefaultTaskPool<>(2, 10);
        pool.close();

        assertFalse(pool.submit(() -> Optional.of(1)));
        assertDoesNotThrow(() -> pool.close());
        assertTrue(pool.isClosed());
    }

    @Test
    @DisplayName("Every submission accepted while close runs concurrently is executed")
    void submitRacingClose() throws Exception {
        pool = new DefaultTaskPool<>(2, 65535);
        int submitterCount = 4;
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger nextId = new AtomicInteger();
        AtomicBoolean stop = new AtomicBoolean(false);
        CountDownLatch running = new CountDownLatch(submitterCount);
        List<Thread> submitters = new ArrayList<>();

        for (int t = 0; t < submitterCount; t++) {
            Thread submitter = new Thread(() -> {
                running.countDown();
                while (!stop.get()) {
                    int taskId = nextId.incrementAndGet();
                    if (pool.submit(() -> Optional.of(taskId))) {
                        accepted.incrementAndGet();
                    }
                    LockSupport.parkNanos(50_000);
                }
            });
            submitters.add(submitter);
            submitter.start();
        }
        assertTrue(running.await(5, TimeUnit.SECONDS));
        Thread.sleep(20);

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> pool.close());
        stop.set(true);
        for (Thread submitter : submitters) {
            submitter.join(5000);
        }

        assertFalse(pool.submit(() -> Optional.of(-1)));
        assertEquals(0, pool.getWaitingQueueCount());
        assertEquals(accepted.get(), pool.collectAll().size());
    }

    @Test
    @DisplayName("Try-with-resources closes the pool")
    void tryWithResources() {
        DefaultTaskPool<Integer> scoped;
        try (DefaultTaskPool<Integer> p = new DefaultTaskPool<>(2, 10)) {
            scoped = p;
            assertTrue(p.submit(() -> Optional.of(1)));
        }
        assertTrue(scoped.isClosed());
        assertEquals(List.of(1), scoped.collectAll());
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    static <R> List<R> awaitResults(TaskPool<R> pool, int expected, Duration timeout) throws InterruptedException {
        List<R> collected = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (collected.size() < expected && System.nanoTime() < deadline) {
            collected.addAll(pool.collectAll());
            if (collected.size() < expected) {
                Thread.sleep(5);
            }
        }
        return collected;
    }

    private static void awaitResultsCount(TaskPool<?> pool, int expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pool.getResultsCount() < expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    private static void awaitIdle(TaskPool<?> pool, int expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pool.getIdleThreadsCount() < expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, pool.getIdleThreadsCount());
    }
}
