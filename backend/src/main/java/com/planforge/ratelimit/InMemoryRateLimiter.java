package com.planforge.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Sliding-window limiter kept in process memory. Only correct for a single instance; multi-instance
 * deployments use {@link RedisRateLimiter}.
 * <p>
 * Users idle for a whole window are evicted, and at most {@code maxTrackedUsers} are kept with the
 * least recently seen dropped first.
 */
public class InMemoryRateLimiter implements RateLimiter {

    static final long DEFAULT_MAX_TRACKED_USERS = 50_000;

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Cache<UUID, Deque<Instant>> requestsByUser;

    public InMemoryRateLimiter(int maxRequests, Duration window, Clock clock) {
        this(maxRequests, window, clock, DEFAULT_MAX_TRACKED_USERS);
    }

    public InMemoryRateLimiter(int maxRequests, Duration window, Clock clock, long maxTrackedUsers) {
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.requestsByUser = Caffeine.newBuilder()
                .maximumSize(maxTrackedUsers)
                .expireAfterAccess(window)
                .ticker(() -> {
                    Instant now = clock.instant();
                    return now.getEpochSecond() * 1_000_000_000L + now.getNano();
                })
                .executor(Runnable::run)
                .build();
    }

    @Override
    public RateLimitDecision checkAndIncrement(UUID userId) {
        Instant now = clock.instant();
        Deque<Instant> requests = requestsByUser.get(userId, ignored -> new ArrayDeque<>());
        synchronized (requests) {
            Instant windowStart = now.minus(window);
            while (!requests.isEmpty() && !requests.peekFirst().isAfter(windowStart)) {
                requests.pollFirst();
            }
            if (requests.size() >= maxRequests) {
                return RateLimitDecision.deny(computeRetryAfterSeconds(requests.peekFirst(), now, window));
            }
            requests.addLast(now);
            return RateLimitDecision.allow(maxRequests - requests.size());
        }
    }

    long trackedUsers() {
        requestsByUser.cleanUp();
        return requestsByUser.estimatedSize();
    }

    static long computeRetryAfterSeconds(Instant oldest, Instant now, Duration window) {
        if (oldest == null) {
            return window.toSeconds();
        }
        long millis = oldest.plus(window).toEpochMilli() - now.toEpochMilli();
        return Math.max(0L, (millis + 999L) / 1000L);
    }
}
