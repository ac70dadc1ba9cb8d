package com.examkit.runtime;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.MDC;

/**
 * Bounded pool for per-batch and per-topic work plus an unbounded lane for blocking collaborator
 * calls that need a timeout. Tasks inherit the submitting thread's MDC.
 */
public class WorkerPool implements AutoCloseable {
    private final ExecutorService workers;
    private final ExecutorService calls;
    private final int threads;

    public WorkerPool(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("worker threads must be >= 1");
        }
        this.threads = threads;
        this.workers = Executors.newFixedThreadPool(threads, named("examkit-worker"));
        this.calls = Executors.newCachedThreadPool(named("examkit-call"));
    }

    public int threads() {
        return threads;
    }

    public <T> Future<T> submit(Callable<T> task) {
        return workers.submit(withMdc(task));
    }

    public <T> Future<T> call(Callable<T> blockingCall) {
        return calls.submit(withMdc(blockingCall));
    }

    @Override
    public void close() {
        workers.shutdownNow();
        calls.shutdownNow();
        try {
            workers.awaitTermination(5, TimeUnit.SECONDS);
            calls.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
