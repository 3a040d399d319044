package com.planforge.ratelimit;

import java.util.UUID;

/**
 * Per-user request budget for AI generation. A call both checks and consumes one unit.
 */
public interface RateLimiter {

    RateLimitDecision checkAndIncrement(UUID userId);
}
