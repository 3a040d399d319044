package com.planforge.generation.service;

public record ProviderResponse(
        String content,
        ProviderMetadata metadata
) {
}
