package com.planforge.streaming;

import com.planforge.generation.model.FailureClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Maps a failure to the fixed code and message a client is allowed to see. The raw error is logged
 * and goes no further.
 */
@Component
public class ErrorSanitizer {

    private static final Logger log = LoggerFactory.getLogger(ErrorSanitizer.class);

    public SanitizedError sanitize(UUID planId, String rawError, FailureClassification classification) {
        FailureClassification effective = classification == null ? FailureClassification.UNKNOWN : classification;
        log.warn("Generation error for plan {} ({}): {}", planId, effective.wireName(), rawError);
        return new SanitizedError(code(effective), message(effective), effective, effective.isRetryable());
    }

    static String code(FailureClassification classification) {
        return switch (classification) {
            case VALIDATION -> "INVALID_OUTPUT";
            case PROVIDER_ERROR -> "PROVIDER_ERROR";
            case RATE_LIMIT -> "RATE_LIMITED";
            case TIMEOUT -> "GENERATION_TIMEOUT";
            case CAPPED -> "ATTEMPTS_EXHAUSTED";
            case IN_PROGRESS -> "GENERATION_IN_PROGRESS";
            case UNKNOWN -> "GENERATION_FAILED";
        };
    }

    static String message(FailureClassification classification) {
        return switch (classification) {
            case VALIDATION -> "The generated plan did not pass validation.";
            case PROVIDER_ERROR -> "The plan generator is temporarily unavailable. Please try again.";
            case RATE_LIMIT -> "Too many generation requests. Please wait before trying again.";
            case TIMEOUT -> "Plan generation took too long. Please try again.";
            case CAPPED -> "This plan has used all of its generation attempts.";
            case IN_PROGRESS -> "A generation for this plan is already running.";
            case UNKNOWN -> "Plan generation failed. Please try again.";
        };
    }
}
