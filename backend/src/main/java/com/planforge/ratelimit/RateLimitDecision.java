package com.planforge.ratelimit;

public record RateLimitDecision(
        boolean allowed,
        int remaining,
        Long retryAfterSeconds
) {

    public static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, remaining, null);
    }

    public static RateLimitDecision deny(long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, retryAfterSeconds);
    }
}
