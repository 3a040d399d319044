package com.planforge.generation.service;

import com.planforge.generation.model.FailureClassification;

/**
 * Failure raised by a {@link PlanGenerationProvider}. The adapter decides the classification when it
 * constructs the exception; nothing downstream inspects the cause to reclassify it.
 */
public class ProviderException extends RuntimeException {

    private final FailureClassification classification;
    private final ProviderMetadata metadata;

    public ProviderException(FailureClassification classification, String message) {
        this(classification, message, null, null);
    }

    public ProviderException(FailureClassification classification, String message, Throwable cause) {
        this(classification, message, cause, null);
    }

    public ProviderException(FailureClassification classification,
                             String message,
                             Throwable cause,
                             ProviderMetadata metadata) {
        super(message, cause);
        this.classification = classification;
        this.metadata = metadata;
    }

    public FailureClassification getClassification() {
        return classification;
    }

    public ProviderMetadata getMetadata() {
        return metadata;
    }
}
