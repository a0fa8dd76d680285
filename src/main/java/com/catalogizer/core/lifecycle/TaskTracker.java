package com.catalogizer.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs and counts every background task the manager spawns, and carries the single
 * broadcast shutdown signal those tasks race against.
 * <p>
 * Once {@link #shutdown()} fires, new submissions are refused, blocked
 * {@link #awaitShutdown(Duration)} calls return immediately, and {@link #awaitIdle(Duration)}
 * lets the owner join everything still running.
 */
public final class TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(TaskTracker.class);

    private final ExecutorService executor;
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);
    private final AtomicInteger active = new AtomicInteger();
    private final Object idleMonitor = new Object();

    public TaskTracker(String threadPrefix) {
        this.executor = Executors.newCachedThreadPool(namedDaemonThreads(threadPrefix));
    }

    /**
     * Submits a tracked task.
     *
     * @param name short label used in log output
     * @param task work to run on a pool thread
     * @return false if shutdown has begun and the task was not started
     */
    public boolean submit(String name, Runnable task) {
        if (isShutdown()) {
            log.debug("Rejected task {} after shutdown", name);
            return false;
        }
        active.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Task {} failed: {}", name, e.getMessage(), e);
                } finally {
                    release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            release();
            log.debug("Executor refused task {}", name);
            return false;
        }
    }

    /** Fires the shutdown signal. Safe to call more than once. */
    public void shutdown() {
        shutdownSignal.countDown();
    }

    public boolean isShutdown() {
        return shutdownSignal.getCount() == 0;
    }

    /**
     * Waits for {@code delay} unless shutdown fires first.
     *
     * @return true if shutdown fired (the caller should stop), false if the delay elapsed
     */
    public boolean awaitShutdown(Duration delay) {
        try {
            return shutdownSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Blocks until no tracked task is running or the timeout elapses.
     *
     * @return true if every tracked task finished
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (active.get() > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    idleMonitor.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return active.get() == 0;
                }
            }
        }
        return true;
    }

    /** Releases the pool threads. Tasks still running are interrupted. */
    public void close() {
        executor.shutdownNow();
    }

    public int activeCount() {
        return active.get();
    }

    private void release() {
        if (active.decrementAndGet() == 0) {
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }

    /** Daemon threads named {@code prefix-N}. */
    public static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
