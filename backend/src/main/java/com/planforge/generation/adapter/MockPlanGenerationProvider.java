package com.planforge.generation.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planforge.common.cancel.CancellationToken;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.PlanGenerationProvider;
import com.planforge.generation.service.ProviderException;
import com.planforge.generation.service.ProviderMetadata;
import com.planforge.generation.service.ProviderResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Deterministic provider for local runs and tests. Produces a plan sized by the weekly hours.
 */
@Component
@ConditionalOnProperty(value = "app.ai.provider", havingValue = "mock", matchIfMissing = true)
public class MockPlanGenerationProvider implements PlanGenerationProvider {

    static final String PROVIDER = "mock";
    static final String MODEL = "mock-generator-v1";

    private final ObjectMapper objectMapper;

    public MockPlanGenerationProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderResponse generate(GenerationInput input, CancellationToken cancellationToken) {
        int moduleCount = Math.max(2, Math.min(6, input.weeklyHours() / 2));
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode modules = root.putArray("modules");
        for (int i = 1; i <= moduleCount; i++) {
            cancellationToken.throwIfCancelled();
            ObjectNode module = modules.addObject();
            module.put("title", "%s: part %d".formatted(input.topic(), i));
            module.put("description", "Builds %s skills in %s, step %d.".formatted(
                    input.skillLevel().name().toLowerCase(Locale.ROOT), input.topic(), i));
            module.put("estimatedMinutes", 120);
            ArrayNode tasks = module.putArray("tasks");
            for (int j = 1; j <= 3; j++) {
                ObjectNode task = tasks.addObject();
                task.put("title", "Exercise %d.%d".formatted(i, j));
                task.put("description", "Practice item %d for part %d.".formatted(j, i));
                task.put("estimatedMinutes", 40);
            }
        }

        try {
            return new ProviderResponse(
                    objectMapper.writeValueAsString(root),
                    new ProviderMetadata(PROVIDER, MODEL, 100, 500, 600)
            );
        } catch (JsonProcessingException exception) {
            throw new ProviderException(FailureClassification.PROVIDER_ERROR, "Mock provider could not serialize plan", exception);
        }
    }
}
