package com.planforge.generation.service;

import com.planforge.common.cancel.CancellationToken;

public interface PlanGenerationProvider {

    /**
     * Produces the raw plan document for the given input. Implementations check the token between
     * blocking steps and stop promptly once it is cancelled.
     *
     * @throws ProviderException on any provider-side failure
     */
    ProviderResponse generate(GenerationInput input, CancellationToken cancellationToken);
}
