package com.planforge.generation.service;

import com.planforge.plans.model.PlanGenerationStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Either a reserved attempt slot (with the sanitized input it was reserved for) or the reason the
 * slot was refused.
 */
public record AttemptReservation(
        boolean reserved,
        UUID planId,
        UUID attemptId,
        int attemptNumber,
        GenerationInput input,
        String promptHash,
        Instant startedAt,
        ReservationRejection reason,
        PlanGenerationStatus currentStatus,
        Long retryAfterSeconds
) {

    public static AttemptReservation reserved(UUID planId,
                                              UUID attemptId,
                                              int attemptNumber,
                                              GenerationInput input,
                                              String promptHash,
                                              Instant startedAt) {
        return new AttemptReservation(true, planId, attemptId, attemptNumber, input, promptHash, startedAt,
                null, PlanGenerationStatus.GENERATING, null);
    }

    public static AttemptReservation rejected(UUID planId,
                                              ReservationRejection reason,
                                              PlanGenerationStatus currentStatus) {
        return new AttemptReservation(false, planId, null, 0, null, null, null, reason, currentStatus, null);
    }

    public static AttemptReservation rateLimited(UUID planId, PlanGenerationStatus currentStatus, Long retryAfterSeconds) {
        return new AttemptReservation(false, planId, null, 0, null, null, null,
                ReservationRejection.RATE_LIMITED, currentStatus, retryAfterSeconds);
    }
}
