package com.planforge.jobs.dto;

import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobStatus;
import com.planforge.jobs.model.JobType;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID jobId,
        JobType type,
        JobStatus status,
        int attempts,
        int maxAttempts,
        String error,
        Instant scheduledFor,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {

    public static JobResponse from(JobEntity job) {
        return new JobResponse(
                job.getId(),
                job.getType(),
                job.getStatus(),
                job.getAttempts(),
                job.getMaxAttempts(),
                job.getError(),
                job.getScheduledFor(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
