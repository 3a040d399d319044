package com.planforge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Jwt jwt,
        Ai ai,
        Generation generation,
        Jobs jobs,
        Worker worker,
        RateLimit rateLimit,
        Enrichment enrichment
) {

    public record Jwt(
            String issuer,
            String secret
    ) {}

    public record Ai(
            String provider,
            OpenAi openai,
            Map<String, ModelPricing> pricing
    ) {}

    public record OpenAi(
            String apiKey,
            String model,
            String baseUrl,
            Duration connectTimeout,
            Duration readTimeout
    ) {}

    /**
     * USD per million tokens.
     */
    public record ModelPricing(
            double inputCostPerMillion,
            double outputCostPerMillion
    ) {}

    public record Generation(
            int attemptCap,
            int topicMaxChars,
            int notesMaxChars,
            Duration providerTimeout,
            Duration streamTimeout
    ) {}

    public record Jobs(
            int maxAttempts,
            int regenerationDailyLimit,
            Duration maxRetryDelay
    ) {}

    public record Worker(
            boolean enabled,
            int concurrency,
            Duration pollInterval,
            Duration maxPollBackoff,
            Duration shutdownTimeout
    ) {}

    public record RateLimit(
            String store,
            int maxRequests,
            Duration window,
            String keyPrefix
    ) {}

    public record Enrichment(
            boolean enabled,
            boolean synchronous
    ) {}
}
