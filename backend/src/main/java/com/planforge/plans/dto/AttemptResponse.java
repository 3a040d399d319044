package com.planforge.plans.dto;

import com.planforge.generation.model.AttemptStatus;
import com.planforge.generation.model.FailureClassification;

import java.time.Instant;
import java.util.UUID;

public record AttemptResponse(
        UUID attemptId,
        int attemptNo,
        AttemptStatus status,
        FailureClassification classification,
        Long durationMs,
        Integer modulesCount,
        Integer tasksCount,
        Instant createdAt,
        Instant finishedAt
) {
}
