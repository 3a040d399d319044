package com.planforge.plans.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code overrides} is kept as raw JSON; see {@link com.planforge.plans.service.PlanOverrides}.
 */
public record RegeneratePlanRequest(
        JsonNode overrides
) {
}
