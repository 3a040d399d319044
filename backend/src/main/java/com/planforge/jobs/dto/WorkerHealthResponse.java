package com.planforge.jobs.dto;

import com.planforge.jobs.worker.WorkerState;
import com.planforge.jobs.worker.WorkerStats;

public record WorkerHealthResponse(
        boolean enabled,
        WorkerState state,
        int inFlight,
        WorkerStats.Snapshot stats
) {

    public static WorkerHealthResponse disabled() {
        return new WorkerHealthResponse(false, null, 0, null);
    }
}
