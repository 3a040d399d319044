package com.planforge.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Fixed-window limiter backed by Redis INCR so every instance shares one counter per user and
 * window. Redis outages fail open.
 */
public class RedisRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);

    private final StringRedisTemplate redisTemplate;
    private final int maxRequests;
    private final Duration window;
    private final String keyPrefix;
    private final Clock clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate,
                            int maxRequests,
                            Duration window,
                            String keyPrefix,
                            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.maxRequests = maxRequests;
        this.window = window;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision checkAndIncrement(UUID userId) {
        long nowMillis = clock.millis();
        long windowMillis = window.toMillis();
        long windowIndex = nowMillis / windowMillis;
        String key = keyPrefix + ":" + userId + ":" + windowIndex;

        Long count;
        try {
            count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                redisTemplate.expire(key, window);
            }
        } catch (DataAccessException exception) {
            log.warn("Rate limit store unavailable, allowing request for user {}", userId, exception);
            return RateLimitDecision.allow(maxRequests);
        }

        if (count == null) {
            return RateLimitDecision.allow(maxRequests);
        }
        if (count > maxRequests) {
            long windowEndMillis = (windowIndex + 1) * windowMillis;
            long retryAfter = (long) Math.ceil((windowEndMillis - nowMillis) / 1000.0);
            return RateLimitDecision.deny(Math.max(1L, retryAfter));
        }
        return RateLimitDecision.allow((int) (maxRequests - count));
    }
}
