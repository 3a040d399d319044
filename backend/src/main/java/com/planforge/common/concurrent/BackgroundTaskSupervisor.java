package com.planforge.common.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs side effects that must not hold up the caller (usage recording, enrichment). Every task is
 * tracked while in flight and its failure is logged with the task name instead of being lost.
 */
public class BackgroundTaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskSupervisor.class);

    private final Executor executor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object idleMonitor = new Object();

    public BackgroundTaskSupervisor(Executor executor) {
        this.executor = executor;
    }

    public void submit(String name, Runnable task) {
        inFlight.incrementAndGet();
        try {
            executor.execute(() -> run(name, task));
        } catch (RejectedExecutionException exception) {
            finished();
            log.warn("Background task {} rejected; executor is shutting down", name);
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Blocks until no task is in flight or the timeout elapses.
     *
     * @return true if the supervisor went idle in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inFlight.get() > 0) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMillis);
            }
        }
        return true;
    }

    private void run(String name, Runnable task) {
        try {
            task.run();
        } catch (Exception exception) {
            log.error("Background task {} failed", name, exception);
        } finally {
            finished();
        }
    }

    private void finished() {
        if (inFlight.decrementAndGet() == 0) {
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }
}
