package com.planforge.common.exception;

import org.springframework.http.HttpStatus;

public class TooManyRequestsException extends ApiException {

    private final Long retryAfterSeconds;

    public TooManyRequestsException(String message) {
        this(message, null);
    }

    public TooManyRequestsException(String message, Long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * Seconds until the caller may try again, or {@code null} when unknown.
     */
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
