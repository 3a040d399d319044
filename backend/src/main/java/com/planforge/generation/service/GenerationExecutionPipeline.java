package com.planforge.generation.service;

import com.planforge.common.cancel.CancellationToken;
import com.planforge.config.AppProperties;
import com.planforge.generation.model.FailureClassification;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one generation attempt: a single provider call under a cancellation token, then parsing of the
 * returned document. Expected failures come back as {@link GenerationResult.Failure}; only
 * programming errors escape.
 */
@Service
public class GenerationExecutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(GenerationExecutionPipeline.class);
    private static final long CANCEL_CHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final PlanGenerationProvider defaultProvider;
    private final PlanResponseParser parser;
    private final ExecutorService providerExecutor;
    private final Duration providerTimeout;
    private final MeterRegistry meterRegistry;
    private final Timer latencyTimer;

    public GenerationExecutionPipeline(PlanGenerationProvider defaultProvider,
                                       PlanResponseParser parser,
                                       @Qualifier("providerExecutor") ExecutorService providerExecutor,
                                       AppProperties appProperties,
                                       MeterRegistry meterRegistry) {
        this.defaultProvider = defaultProvider;
        this.parser = parser;
        this.providerExecutor = providerExecutor;
        this.providerTimeout = appProperties.generation().providerTimeout();
        this.meterRegistry = meterRegistry;
        this.latencyTimer = meterRegistry.timer("generation.attempt.latency");
    }

    public GenerationResult run(AttemptContext context, CancellationToken cancellationToken) {
        return run(context, defaultProvider, cancellationToken);
    }

    public GenerationResult run(AttemptContext context,
                                PlanGenerationProvider provider,
                                CancellationToken cancellationToken) {
        long startedAt = System.nanoTime();
        GenerationResult result = execute(context, provider, cancellationToken, startedAt);
        latencyTimer.record(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS);
        String outcome = result instanceof GenerationResult.Failure failure
                ? failure.classification().wireName()
                : "success";
        meterRegistry.counter("generation.attempt.outcome", "outcome", outcome).increment();
        return result;
    }

    private GenerationResult execute(AttemptContext context,
                                     PlanGenerationProvider provider,
                                     CancellationToken cancellationToken,
                                     long startedAt) {
        ProviderResponse response;
        try {
            response = callProvider(provider, context.input(), cancellationToken);
        } catch (ProviderException exception) {
            log.warn("Provider failed for attempt {} of plan {}: {} ({})",
                    context.attemptId(), context.planId(), exception.getMessage(), exception.getClassification());
            return failure(exception.getMessage(), exception.getClassification(), startedAt, exception.getMetadata());
        } catch (CancellationException exception) {
            log.info("Attempt {} of plan {} cancelled", context.attemptId(), context.planId());
            return failure("Generation cancelled", FailureClassification.TIMEOUT, startedAt, null);
        } catch (TimeoutException exception) {
            log.warn("Provider timed out after {} for attempt {}", providerTimeout, context.attemptId());
            return failure("Provider did not respond within " + providerTimeout, FailureClassification.TIMEOUT, startedAt, null);
        }

        List<ParsedModule> modules;
        try {
            modules = parser.parse(response.content());
        } catch (PlanParseException exception) {
            log.warn("Provider output for attempt {} failed validation: {}", context.attemptId(), exception.getMessage());
            return failure(exception.getMessage(), FailureClassification.VALIDATION, startedAt, response.metadata());
        }

        return new GenerationResult.Success(modules, elapsedMillis(startedAt), context.attemptId(), response.metadata());
    }

    private ProviderResponse callProvider(PlanGenerationProvider provider,
                                          GenerationInput input,
                                          CancellationToken cancellationToken) throws TimeoutException {
        cancellationToken.throwIfCancelled();
        Future<ProviderResponse> future = providerExecutor.submit(() -> provider.generate(input, cancellationToken));
        long deadline = System.nanoTime() + providerTimeout.toNanos();
        try {
            while (!awaitDone(future, CANCEL_CHECK_NANOS)) {
                if (cancellationToken.isCancelled()) {
                    future.cancel(true);
                    throw new CancellationException("Generation cancelled");
                }
                if (System.nanoTime() - deadline >= 0) {
                    future.cancel(true);
                    throw new TimeoutException("Provider timed out");
                }
            }
            ProviderResponse response = future.get();
            if (response == null) {
                throw new ProviderException(FailureClassification.PROVIDER_ERROR, "Provider returned no response");
            }
            return response;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Interrupted while waiting for provider");
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ProviderException(FailureClassification.PROVIDER_ERROR, "Provider call failed", cause);
        }
    }

    private static boolean awaitDone(Future<?> future, long nanos) throws InterruptedException {
        try {
            future.get(nanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException notYet) {
            return false;
        } catch (ExecutionException | CancellationException finished) {
            return true;
        }
    }

    private static GenerationResult.Failure failure(String error,
                                                    FailureClassification classification,
                                                    long startedAt,
                                                    ProviderMetadata metadata) {
        return new GenerationResult.Failure(error, classification, elapsedMillis(startedAt), metadata);
    }

    private static long elapsedMillis(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}
