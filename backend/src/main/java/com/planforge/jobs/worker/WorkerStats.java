package com.planforge.jobs.worker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker counters, kept locally for the health endpoint and mirrored to Micrometer.
 */
public class WorkerStats {

    private final AtomicLong polls = new AtomicLong();
    private final AtomicLong idlePolls = new AtomicLong();
    private final AtomicLong jobsStarted = new AtomicLong();
    private final AtomicLong jobsCompleted = new AtomicLong();
    private final AtomicLong jobsFailed = new AtomicLong();

    private final Counter pollCounter;
    private final Counter idlePollCounter;
    private final Counter startedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;

    public WorkerStats(MeterRegistry meterRegistry) {
        this.pollCounter = meterRegistry.counter("worker.polls");
        this.idlePollCounter = meterRegistry.counter("worker.polls.idle");
        this.startedCounter = meterRegistry.counter("worker.jobs", "event", "started");
        this.completedCounter = meterRegistry.counter("worker.jobs", "event", "completed");
        this.failedCounter = meterRegistry.counter("worker.jobs", "event", "failed");
    }

    void recordPoll() {
        polls.incrementAndGet();
        pollCounter.increment();
    }

    void recordIdlePoll() {
        idlePolls.incrementAndGet();
        idlePollCounter.increment();
    }

    void recordStarted() {
        jobsStarted.incrementAndGet();
        startedCounter.increment();
    }

    void recordCompleted() {
        jobsCompleted.incrementAndGet();
        completedCounter.increment();
    }

    void recordFailed() {
        jobsFailed.incrementAndGet();
        failedCounter.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(polls.get(), idlePolls.get(), jobsStarted.get(), jobsCompleted.get(), jobsFailed.get());
    }

    public record Snapshot(
            long polls,
            long idlePolls,
            long jobsStarted,
            long jobsCompleted,
            long jobsFailed
    ) {}
}
