package com.planforge.jobs.handler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * {@code overrides} stays raw JSON so an absent field and an explicit {@code null} remain distinguishable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegenerationJobPayload(
        @NotNull UUID planId,
        JsonNode overrides
) {
}
