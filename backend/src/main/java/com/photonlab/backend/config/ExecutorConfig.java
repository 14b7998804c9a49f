package com.photonlab.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for sweep execution.
 *
 * <ul>
 *   <li>{@code sweepWorkerExecutor}: runs the per-job worker loops; loops beyond the solve cap wait on {@code solveSlots}.</li>
 *   <li>{@code solverCallExecutor}: hosts individual solver calls when a task timeout is configured.</li>
 *   <li>{@code progressDeliveryExecutor}: pushes progress snapshots to subscribers off the worker threads.</li>
 *   <li>{@code solveSlots}: fair semaphore capping solver calls across all jobs.</li>
 * </ul>
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "sweepWorkerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService sweepWorkerExecutor() {
        return Executors.newCachedThreadPool(named("sweep-worker"));
    }

    @Bean(name = "solverCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService solverCallExecutor() {
        return Executors.newCachedThreadPool(named("solver-call"));
    }

    @Bean(name = "progressDeliveryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService progressDeliveryExecutor() {
        return Executors.newCachedThreadPool(named("progress-delivery"));
    }

    @Bean
    public Semaphore solveSlots(PhotonLabProperties properties) {
        return new Semaphore(properties.getSweep().resolvedConcurrentSolves(), true);
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
