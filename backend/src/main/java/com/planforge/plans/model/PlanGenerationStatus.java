package com.planforge.plans.model;

public enum PlanGenerationStatus {
    PENDING,
    GENERATING,
    READY,
    FAILED
}
