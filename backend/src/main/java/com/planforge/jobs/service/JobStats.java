package com.planforge.jobs.service;

import com.planforge.jobs.model.JobStatus;

import java.time.Instant;
import java.util.Map;

public record JobStats(
        Instant since,
        Map<JobStatus, Long> countsByStatus,
        long total,
        Long averageProcessingMs,
        double failureRate
) {
}
