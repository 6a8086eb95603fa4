package com.tinypool;

import com.tinypool.core.TaskPool;
import com.tinypool.spring.EnablePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Example Spring Boot application: a producer submits batches of tasks with random
 * durations and polls for whatever has finished.
 */
@SpringBootApplication
@EnablePool
public class PoolApplication {

    private static final Logger log = LoggerFactory.getLogger(PoolApplication.class);

    private static final int ROUNDS = 3;
    private static final long POLL_INTERVAL_MS = 1000;

    public static void main(String[] args) {
        SpringApplication.run(PoolApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TaskPool<Object> taskPool) {
        return args -> {
            log.info("=== Pool Demo Started (workers={}) ===", taskPool.getWorkerCount());

            int nextId = 10000;
            int outstanding = 0;
            for (int round = 0; round < ROUNDS; round++) {
                int batch = ThreadLocalRandom.current().nextInt(3, 6);
                for (int i = 0; i < batch; i++) {
                    int taskId = nextId++;
                    long duration = ThreadLocalRandom.current().nextLong(100, 800);
                    boolean accepted = taskPool.submit(() -> {
                        log.info("Task[{}] executing ({}ms)", taskId, duration);
                        Thread.sleep(duration);
                        return Optional.of(taskId);
                    });
                    if (accepted) {
                        outstanding++;
                    } else {
                        log.warn("Task[{}] rejected, queue full", taskId);
                    }
                }
                outstanding -= report(taskPool);
            }

            while (outstanding > 0) {
                outstanding -= report(taskPool);
            }

            log.info("=== All Tasks Completed ===");
        };
    }

    private static int report(TaskPool<Object> taskPool) throws InterruptedException {
        log.info("idle={}, waiting={}", taskPool.getIdleThreadsCount(), taskPool.getWaitingQueueCount());
        Thread.sleep(POLL_INTERVAL_MS);
        List<Object> results = taskPool.collectAll();
        for (Object result : results) {
            log.info("Task[{}] complete", result);
        }
        return results.size();
    }
}
