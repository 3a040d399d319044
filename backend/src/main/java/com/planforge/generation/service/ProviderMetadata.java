package com.planforge.generation.service;

public record ProviderMetadata(
        String provider,
        String model,
        long inputTokens,
        long outputTokens,
        long totalTokens
) {

    public boolean hasUsage() {
        return inputTokens > 0 || outputTokens > 0;
    }
}
