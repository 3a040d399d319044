package com.planforge.generation.service;

import com.planforge.generation.model.FailureClassification;

public enum ReservationRejection {
    CAPPED(FailureClassification.CAPPED),
    RATE_LIMITED(FailureClassification.RATE_LIMIT),
    INVALID_STATUS(FailureClassification.VALIDATION),
    IN_PROGRESS(FailureClassification.IN_PROGRESS);

    private final FailureClassification classification;

    ReservationRejection(FailureClassification classification) {
        this.classification = classification;
    }

    public FailureClassification classification() {
        return classification;
    }
}
