package com.planforge.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FailureClassification {
    VALIDATION(false),
    PROVIDER_ERROR(true),
    RATE_LIMIT(true),
    TIMEOUT(true),
    CAPPED(false),
    IN_PROGRESS(false),
    // cause unknown, so retried conservatively
    UNKNOWN(true);

    private final boolean retryable;

    FailureClassification(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
