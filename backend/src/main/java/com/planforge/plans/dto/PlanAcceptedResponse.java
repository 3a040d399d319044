package com.planforge.plans.dto;

import java.util.UUID;

public record PlanAcceptedResponse(
        UUID planId,
        UUID jobId,
        String status
) {
}
