package com.codeagent.guard.service;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool for the asynchronous gateway calls. A task submitted from one of the pool's own
 * threads goes to an unbounded overflow executor instead, so a worker waiting on a nested call
 * can never starve the pool. Tasks that do not fit the queue also go to the overflow executor;
 * once closed, every submission is rejected with {@link RejectedExecutionException}.
 */
public final class GatewayWorkers implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GatewayWorkers.class);
    private static final int QUEUE_CAPACITY = 1_000;
    private static final ThreadLocal<GatewayWorkers> OWNER = new ThreadLocal<>();
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ThreadPoolExecutor pool;
    private final ExecutorService overflow;

    public GatewayWorkers(int threads) {
        this(threads, QUEUE_CAPACITY);
    }

    GatewayWorkers(int threads, int queueCapacity) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, was " + threads);
        }
        int id = POOL_SEQUENCE.incrementAndGet();
        this.overflow = Executors.newCachedThreadPool(threadFactory("guardrails-" + id + "-overflow-", false));
        this.pool = new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory("guardrails-" + id + "-worker-", true),
                this::rejectToOverflow
        );
    }

    public Executor executorForCaller() {
        return isWorkerThread() ? overflow : pool;
    }

    public boolean isWorkerThread() {
        return OWNER.get() == this;
    }

    public boolean isShutdown() {
        return pool.isShutdown();
    }

    @Override
    public void close() {
        pool.shutdown();
        overflow.shutdown();
        try {
            if (!pool.awaitTermination(2, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
            if (!overflow.awaitTermination(2, TimeUnit.SECONDS)) {
                overflow.shutdownNow();
            }
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            overflow.shutdownNow();
        }
        log.debug("Gateway workers shut down");
    }

    private void rejectToOverflow(Runnable task, ThreadPoolExecutor executor) {
        if (executor.isShutdown()) {
            throw new RejectedExecutionException("Gateway workers are shut down");
        }
        log.debug("Worker queue full; handing task to the overflow executor");
        overflow.execute(task);
    }

    private ThreadFactory threadFactory(String prefix, boolean ownedByPool) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Runnable body = ownedByPool
                    ? () -> {
                        OWNER.set(this);
                        runnable.run();
                    }
                    : runnable;
            Thread thread = new Thread(body, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
