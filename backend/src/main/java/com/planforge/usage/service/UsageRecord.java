package com.planforge.usage.service;

import java.util.UUID;

public record UsageRecord(
        UUID userId,
        String provider,
        String model,
        long inputTokens,
        long outputTokens,
        long costCents,
        String kind
) {
}
