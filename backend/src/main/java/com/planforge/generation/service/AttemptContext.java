package com.planforge.generation.service;

import java.util.UUID;

public record AttemptContext(
        UUID attemptId,
        UUID planId,
        UUID userId,
        GenerationInput input
) {

    public static AttemptContext of(AttemptReservation reservation, UUID userId) {
        return new AttemptContext(reservation.attemptId(), reservation.planId(), userId, reservation.input());
    }
}
