package com.planforge.generation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.TestProperties;
import com.planforge.common.cancel.CancellationSource;
import com.planforge.common.cancel.CancellationToken;
import com.planforge.generation.adapter.MockPlanGenerationProvider;
import com.planforge.generation.model.FailureClassification;
import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.SkillLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationExecutionPipelineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ExecutorService executor;
    private GenerationExecutionPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        pipeline = new GenerationExecutionPipeline(
                new MockPlanGenerationProvider(objectMapper),
                new PlanResponseParser(objectMapper),
                executor,
                TestProperties.defaults(),
                meterRegistry
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void mockProviderProducesParsedPlan() {
        GenerationResult result = pipeline.run(context(8), CancellationToken.NONE);

        assertThat(result).isInstanceOf(GenerationResult.Success.class);
        GenerationResult.Success success = (GenerationResult.Success) result;
        assertThat(success.modules()).hasSize(4);
        assertThat(success.tasksCount()).isEqualTo(12);
        assertThat(success.modules().get(0).estimatedMinutes()).isEqualTo(120);
        assertThat(success.providerMetadata().provider()).isEqualTo("mock");
        assertThat(meterRegistry.counter("generation.attempt.outcome", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void cancelledTokenShortCircuitsAsTimeout() {
        CancellationSource source = new CancellationSource();
        source.cancel();

        GenerationResult result = pipeline.run(context(8), source);

        assertThat(result).isInstanceOf(GenerationResult.Failure.class);
        GenerationResult.Failure failure = (GenerationResult.Failure) result;
        assertThat(failure.classification()).isEqualTo(FailureClassification.TIMEOUT);
        assertThat(failure.error()).isEqualTo("Generation cancelled");
    }

    @Test
    void cancellationWhileProviderBlocksReturnsPromptly() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        PlanGenerationProvider blocking = (input, token) -> {
            entered.countDown();
            try {
                Thread.sleep(TimeUnit.SECONDS.toMillis(30));
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
            }
            return null;
        };
        CancellationSource source = new CancellationSource();
        executor.submit(() -> {
            entered.await();
            source.cancel();
            return null;
        });

        long started = System.nanoTime();
        GenerationResult result = pipeline.run(context(8), blocking, source);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(3000);
        assertThat(((GenerationResult.Failure) result).classification()).isEqualTo(FailureClassification.TIMEOUT);
    }

    @Test
    void providerExceptionKeepsItsClassification() {
        PlanGenerationProvider limited = (input, token) -> {
            throw new ProviderException(FailureClassification.RATE_LIMIT, "OpenAI responded with HTTP 429");
        };

        GenerationResult.Failure failure = (GenerationResult.Failure) pipeline.run(context(8), limited, CancellationToken.NONE);

        assertThat(failure.classification()).isEqualTo(FailureClassification.RATE_LIMIT);
        assertThat(failure.error()).contains("429");
        assertThat(meterRegistry.counter("generation.attempt.outcome", "outcome", "rate_limit").count()).isEqualTo(1.0);
    }

    @Test
    void unparseableOutputIsValidationFailureWithMetadata() {
        ProviderMetadata metadata = new ProviderMetadata("openai", "gpt-4o-mini", 10, 20, 30);
        PlanGenerationProvider broken = (input, token) -> new ProviderResponse("{\"modules\": \"nope\"}", metadata);

        GenerationResult.Failure failure = (GenerationResult.Failure) pipeline.run(context(8), broken, CancellationToken.NONE);

        assertThat(failure.classification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(failure.providerMetadata()).isEqualTo(metadata);
    }

    @Test
    void missingResponseIsProviderError() {
        PlanGenerationProvider empty = (input, token) -> null;

        GenerationResult.Failure failure = (GenerationResult.Failure) pipeline.run(context(8), empty, CancellationToken.NONE);

        assertThat(failure.classification()).isEqualTo(FailureClassification.PROVIDER_ERROR);
    }

    private AttemptContext context(int weeklyHours) {
        GenerationInput input = new GenerationInput("Rust", null, SkillLevel.BEGINNER, weeklyHours,
                LearningStyle.PRACTICE, null, null);
        return new AttemptContext(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), input);
    }
}
