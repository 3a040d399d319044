package com.planforge.jobs.worker;

import com.planforge.common.cancel.CancellationSource;
import com.planforge.config.AppProperties;
import com.planforge.generation.model.FailureClassification;
import com.planforge.jobs.handler.JobHandler;
import com.planforge.jobs.handler.JobOutcome;
import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobStatus;
import com.planforge.jobs.model.JobType;
import com.planforge.jobs.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the job queue on a single thread and runs claimed jobs on a fixed pool. A semaphore with one
 * permit per pool thread keeps the number of claimed-but-unfinished jobs at or below the configured
 * concurrency, so the poller never claims work it cannot start.
 */
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobStore jobStore;
    private final Map<JobType, JobHandler> handlers;
    private final AppProperties.Worker config;
    private final WorkerStats stats;
    private final Semaphore permits;
    private final CancellationSource cancellation = new CancellationSource();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final List<AutoCloseable> closeables = new CopyOnWriteArrayList<>();

    private volatile WorkerState state = WorkerState.IDLE;
    private Thread poller;
    private ExecutorService jobExecutor;

    public JobWorker(JobStore jobStore, List<JobHandler> handlers, AppProperties.Worker config, WorkerStats stats) {
        if (config.concurrency() < 1) {
            throw new IllegalArgumentException("Worker concurrency must be at least 1");
        }
        this.jobStore = jobStore;
        this.handlers = index(handlers);
        this.config = config;
        this.stats = stats;
        this.permits = new Semaphore(config.concurrency());
    }

    public synchronized void start() {
        if (state == WorkerState.RUNNING) {
            return;
        }
        if (state != WorkerState.IDLE) {
            throw new IllegalStateException("Worker cannot be restarted once stopped");
        }
        AtomicInteger threadCounter = new AtomicInteger();
        jobExecutor = Executors.newFixedThreadPool(config.concurrency(), runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        poller = new Thread(this::pollLoop, "job-poller");
        poller.setDaemon(true);
        state = WorkerState.RUNNING;
        poller.start();
        log.info("Job worker started: types={}, concurrency={}, pollInterval={}",
                handlers.keySet(), config.concurrency(), config.pollInterval());
    }

    /**
     * Cancels running jobs and waits for them to drain.
     *
     * @throws WorkerShutdownTimeoutException if the poller or a job is still running after the
     *                                        shutdown timeout; resources are released first
     */
    public void stop() {
        synchronized (this) {
            if (state == WorkerState.IDLE) {
                state = WorkerState.STOPPED;
                releaseCloseables();
                return;
            }
            if (state != WorkerState.RUNNING) {
                return;
            }
            state = WorkerState.STOPPING;
        }

        log.info("Stopping job worker");
        cancellation.cancel();
        stopSignal.countDown();

        Duration timeout = config.shutdownTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained;
        try {
            poller.join(Math.max(1, remainingMillis(deadline)));
            jobExecutor.shutdown();
            drained = jobExecutor.awaitTermination(remainingMillis(deadline), TimeUnit.MILLISECONDS)
                    && !poller.isAlive();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            drained = false;
        }

        if (!drained) {
            jobExecutor.shutdownNow();
        }
        releaseCloseables();
        state = WorkerState.STOPPED;

        if (!drained) {
            throw new WorkerShutdownTimeoutException(timeout);
        }
        log.info("Job worker stopped");
    }

    /**
     * Container destroy hook; a timed out shutdown is logged rather than failing context close.
     */
    public void shutdown() {
        try {
            stop();
        } catch (WorkerShutdownTimeoutException exception) {
            log.warn("{}; abandoned jobs will be retried once their rows are requeued", exception.getMessage());
        }
    }

    /**
     * Registers a resource closed after the job pool drains.
     */
    public void registerCloseable(AutoCloseable closeable) {
        closeables.add(closeable);
    }

    public WorkerState state() {
        return state;
    }

    public WorkerStats.Snapshot stats() {
        return stats.snapshot();
    }

    public int inFlight() {
        return config.concurrency() - permits.availablePermits();
    }

    private void pollLoop() {
        Duration backoff = config.pollInterval();
        while (state == WorkerState.RUNNING) {
            try {
                if (!permits.tryAcquire(config.pollInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                return;
            }

            Optional<JobEntity> claimed;
            try {
                stats.recordPoll();
                claimed = jobStore.claimNext(handlers.keySet());
                backoff = config.pollInterval();
            } catch (RuntimeException exception) {
                permits.release();
                log.error("Failed to claim next job; backing off for {}", backoff, exception);
                if (pause(backoff)) {
                    return;
                }
                backoff = doubled(backoff);
                continue;
            }

            if (claimed.isEmpty()) {
                permits.release();
                stats.recordIdlePoll();
                if (pause(config.pollInterval())) {
                    return;
                }
                continue;
            }

            dispatch(claimed.get());
        }
    }

    void dispatch(JobEntity job) {
        stats.recordStarted();
        try {
            jobExecutor.execute(() -> {
                try {
                    runJob(job);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException exception) {
            permits.release();
            log.warn("Job {} claimed during shutdown; returning it to the queue", job.getId());
            try {
                jobStore.release(job.getId());
            } catch (RuntimeException releaseError) {
                log.error("Could not return job {} to the queue; it stays PROCESSING", job.getId(), releaseError);
            }
        }
    }

    void runJob(JobEntity job) {
        MDC.put("jobId", String.valueOf(job.getId()));
        if (job.getPlanId() != null) {
            MDC.put("planId", job.getPlanId().toString());
        }
        JobHandler handler = handlers.get(job.getType());
        try {
            if (handler == null) {
                stats.recordFailed();
                recordFailure(null, job, "No handler registered for " + job.getType(), false);
                return;
            }

            JobOutcome outcome = handler.processJob(job, cancellation);
            if (outcome instanceof JobOutcome.Success success) {
                stats.recordCompleted();
                jobStore.complete(job.getId(), success.result());
                log.info("Job {} completed", job.getId());
            } else {
                JobOutcome.Failure failure = (JobOutcome.Failure) outcome;
                stats.recordFailed();
                log.info("Job {} failed ({}, retryable={}): {}",
                        job.getId(), failure.classification(), failure.retryable(), failure.error());
                recordFailure(handler, job, failure.error(), failure.retryable());
            }
        } catch (Exception exception) {
            stats.recordFailed();
            log.error("Handler for job {} threw", job.getId(), exception);
            recordFailure(handler, job, FailureClassification.UNKNOWN.wireName() + ": " + exception.getMessage(), true);
        } finally {
            MDC.remove("jobId");
            MDC.remove("planId");
        }
    }

    private void recordFailure(JobHandler handler, JobEntity job, String error, boolean retryable) {
        Optional<JobEntity> updated;
        try {
            updated = jobStore.fail(job.getId(), error, retryable);
        } catch (RuntimeException exception) {
            log.error("Could not record failure for job {}; it stays PROCESSING", job.getId(), exception);
            return;
        }
        if (!retryable || handler == null) {
            return;
        }
        updated.filter(row -> row.getStatus() == JobStatus.FAILED).ifPresent(row -> {
            try {
                handler.onRetriesExhausted(row);
            } catch (RuntimeException exception) {
                log.error("Exhaustion hook failed for job {}", job.getId(), exception);
            }
        });
    }

    /**
     * @return true if the worker was asked to stop while pausing
     */
    private boolean pause(Duration duration) {
        try {
            return stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private Duration doubled(Duration backoff) {
        Duration next = backoff.multipliedBy(2);
        return next.compareTo(config.maxPollBackoff()) > 0 ? config.maxPollBackoff() : next;
    }

    private void releaseCloseables() {
        for (AutoCloseable closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception exception) {
                log.warn("Failed to release worker resource {}", closeable, exception);
            }
        }
        closeables.clear();
    }

    private static long remainingMillis(long deadline) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
    }

    private static Map<JobType, JobHandler> index(List<JobHandler> handlers) {
        Map<JobType, JobHandler> byType = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobHandler previous = byType.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.type());
            }
        }
        return byType;
    }
}
