package com.planforge.plans.dto;

import com.planforge.jobs.dto.JobResponse;
import com.planforge.plans.model.PlanGenerationStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PlanStatusResponse(
        UUID planId,
        String topic,
        PlanGenerationStatus generationStatus,
        Instant finalizedAt,
        long modulesCount,
        List<AttemptResponse> attempts,
        JobResponse latestJob
) {
}
