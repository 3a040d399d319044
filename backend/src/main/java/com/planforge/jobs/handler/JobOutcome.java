package com.planforge.jobs.handler;

import com.planforge.generation.model.FailureClassification;

import java.util.Map;

public sealed interface JobOutcome permits JobOutcome.Success, JobOutcome.Failure {

    static JobOutcome success(Map<String, Object> result) {
        return new Success(result);
    }

    static JobOutcome failure(String error, FailureClassification classification, boolean retryable) {
        return new Failure(error, classification, retryable);
    }

    record Success(Map<String, Object> result) implements JobOutcome {
    }

    record Failure(String error, FailureClassification classification, boolean retryable) implements JobOutcome {
    }
}
