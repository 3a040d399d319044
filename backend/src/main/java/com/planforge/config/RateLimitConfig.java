package com.planforge.config;

import com.planforge.ratelimit.InMemoryRateLimiter;
import com.planforge.ratelimit.RateLimiter;
import com.planforge.ratelimit.RedisRateLimiter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class RateLimitConfig {

    @Bean
    @ConditionalOnProperty(value = "app.rate-limit.store", havingValue = "redis")
    RateLimiter redisRateLimiter(StringRedisTemplate redisTemplate, AppProperties properties) {
        AppProperties.RateLimit rateLimit = properties.rateLimit();
        return new RedisRateLimiter(
                redisTemplate,
                rateLimit.maxRequests(),
                rateLimit.window(),
                rateLimit.keyPrefix(),
                Clock.systemUTC()
        );
    }

    @Bean
    @ConditionalOnProperty(value = "app.rate-limit.store", havingValue = "memory", matchIfMissing = true)
    RateLimiter inMemoryRateLimiter(AppProperties properties) {
        AppProperties.RateLimit rateLimit = properties.rateLimit();
        return new InMemoryRateLimiter(rateLimit.maxRequests(), rateLimit.window(), Clock.systemUTC());
    }
}
