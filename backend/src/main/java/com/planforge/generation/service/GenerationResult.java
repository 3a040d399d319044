package com.planforge.generation.service;

import com.planforge.generation.model.FailureClassification;

import java.util.List;
import java.util.UUID;

public sealed interface GenerationResult permits GenerationResult.Success, GenerationResult.Failure {

    ProviderMetadata providerMetadata();

    long durationMs();

    record Success(
            List<ParsedModule> modules,
            long durationMs,
            UUID attemptId,
            ProviderMetadata providerMetadata
    ) implements GenerationResult {

        public int tasksCount() {
            return modules.stream().mapToInt(module -> module.tasks().size()).sum();
        }
    }

    record Failure(
            String error,
            FailureClassification classification,
            long durationMs,
            ProviderMetadata providerMetadata
    ) implements GenerationResult {
    }
}
