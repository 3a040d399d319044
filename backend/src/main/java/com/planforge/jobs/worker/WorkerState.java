package com.planforge.jobs.worker;

public enum WorkerState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}
