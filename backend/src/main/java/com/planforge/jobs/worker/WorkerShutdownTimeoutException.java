package com.planforge.jobs.worker;

import java.time.Duration;

public class WorkerShutdownTimeoutException extends RuntimeException {

    public WorkerShutdownTimeoutException(Duration timeout) {
        super("Worker did not stop within " + timeout);
    }
}
