package com.planforge.generation.model;

public enum AttemptStatus {
    PROCESSING,
    SUCCEEDED,
    FAILED
}
