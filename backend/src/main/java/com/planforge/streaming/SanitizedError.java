package com.planforge.streaming;

import com.planforge.generation.model.FailureClassification;

public record SanitizedError(
        String code,
        String message,
        FailureClassification classification,
        boolean retryable
) {
}
