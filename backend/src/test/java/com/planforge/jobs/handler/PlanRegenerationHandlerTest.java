package com.planforge.jobs.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.common.cancel.CancellationToken;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.AttemptContext;
import com.planforge.generation.service.AttemptReservation;
import com.planforge.generation.service.AttemptReservationService;
import com.planforge.generation.service.GenerationExecutionPipeline;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.GenerationOutcomeService;
import com.planforge.generation.service.GenerationResult;
import com.planforge.generation.service.ParsedModule;
import com.planforge.generation.service.ParsedTask;
import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobStatus;
import com.planforge.jobs.model.JobType;
import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.model.SkillLevel;
import com.planforge.plans.repo.PlanRepository;
import com.planforge.plans.service.PlanService;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlanRegenerationHandlerTest {

    @Mock
    private AttemptReservationService reservationService;

    @Mock
    private GenerationExecutionPipeline executionPipeline;

    @Mock
    private GenerationOutcomeService outcomeService;

    @Mock
    private PlanRepository planRepository;

    @Mock
    private PlanService planService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private PlanRegenerationHandler handler;

    private final UUID planId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        JobPayloadReader reader = new JobPayloadReader(objectMapper,
                Validation.buildDefaultValidatorFactory().getValidator());
        handler = new PlanRegenerationHandler(reader, reservationService, executionPipeline, outcomeService,
                planRepository, planService);
    }

    @Test
    void overridesAreMergedAndStoredBeforeGeneration() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.of(storedPlan()));
        ArgumentCaptor<GenerationInput> inputCaptor = ArgumentCaptor.forClass(GenerationInput.class);
        when(reservationService.reserve(eq(planId), eq(userId), inputCaptor.capture(),
                eq(Set.of(PlanGenerationStatus.READY, PlanGenerationStatus.FAILED, PlanGenerationStatus.GENERATING))))
                .thenAnswer(inv -> AttemptReservation.reserved(planId, UUID.randomUUID(), 2,
                        inv.getArgument(2), "hash", Instant.now()));
        when(executionPipeline.run(any(AttemptContext.class), any(CancellationToken.class)))
                .thenAnswer(inv -> new GenerationResult.Success(
                        List.of(new ParsedModule("Ownership", null, 90, List.of(new ParsedTask("Borrowing", null, 90)))),
                        250, ((AttemptContext) inv.getArgument(0)).attemptId(), null));

        JobOutcome outcome = handler.processJob(
                job("{\"planId\":\"" + planId + "\",\"overrides\":{\"weeklyHours\":12,\"notes\":null}}"),
                CancellationToken.NONE);

        assertThat(outcome).isInstanceOf(JobOutcome.Success.class);
        GenerationInput merged = inputCaptor.getValue();
        assertThat(merged.topic()).isEqualTo("Rust ownership");
        assertThat(merged.weeklyHours()).isEqualTo(12);
        assertThat(merged.notes()).isNull();
        assertThat(merged.skillLevel()).isEqualTo(SkillLevel.BEGINNER);
        InOrder order = inOrder(planService, executionPipeline);
        order.verify(planService).applyInputs(planId, merged);
        order.verify(executionPipeline).run(any(AttemptContext.class), any(CancellationToken.class));
    }

    @Test
    void mergedInputsStayStoredWhenRegenerationFails() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.of(storedPlan()));
        AttemptReservation reservation = AttemptReservation.reserved(planId, UUID.randomUUID(), 2,
                storedInput(16), "hash", Instant.now());
        when(reservationService.reserve(eq(planId), eq(userId), any(GenerationInput.class), anySet())).thenReturn(reservation);
        GenerationResult.Failure failure = new GenerationResult.Failure(
                "Plan must contain at least one module", FailureClassification.VALIDATION, 120, null);
        when(executionPipeline.run(any(AttemptContext.class), any(CancellationToken.class))).thenReturn(failure);

        JobOutcome.Failure outcome = (JobOutcome.Failure) handler.processJob(
                job("{\"planId\":\"" + planId + "\",\"overrides\":{\"weeklyHours\":16}}"),
                CancellationToken.NONE);

        assertThat(outcome.retryable()).isFalse();
        verify(planService).applyInputs(planId, reservation.input());
        verify(outcomeService).recordFailure(reservation, userId, failure, true);
    }

    @Test
    void failedWriteBackFinalizesAttemptWithoutCallingProvider() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.of(storedPlan()));
        AttemptReservation reservation = AttemptReservation.reserved(planId, UUID.randomUUID(), 2,
                storedInput(4), "hash", Instant.now());
        when(reservationService.reserve(eq(planId), eq(userId), any(GenerationInput.class), anySet())).thenReturn(reservation);
        doThrow(new IllegalStateException("row locked")).when(planService).applyInputs(planId, reservation.input());

        JobOutcome.Failure outcome = (JobOutcome.Failure) handler.processJob(
                job("{\"planId\":\"" + planId + "\"}"), CancellationToken.NONE);

        assertThat(outcome.classification()).isEqualTo(FailureClassification.UNKNOWN);
        assertThat(outcome.retryable()).isTrue();
        verify(outcomeService).recordFailure(eq(reservation), eq(userId), any(GenerationResult.Failure.class), eq(false));
        verifyNoInteractions(executionPipeline);
    }

    @Test
    void unknownOverrideFieldFailsValidation() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.of(storedPlan()));

        JobOutcome.Failure outcome = (JobOutcome.Failure) handler.processJob(
                job("{\"planId\":\"" + planId + "\",\"overrides\":{\"difficulty\":\"hard\"}}"),
                CancellationToken.NONE);

        assertThat(outcome.classification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(outcome.retryable()).isFalse();
        verifyNoInteractions(reservationService);
    }

    @Test
    void clearingRequiredFieldFailsValidation() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.of(storedPlan()));

        JobOutcome.Failure outcome = (JobOutcome.Failure) handler.processJob(
                job("{\"planId\":\"" + planId + "\",\"overrides\":{\"topic\":null}}"),
                CancellationToken.NONE);

        assertThat(outcome.classification()).isEqualTo(FailureClassification.VALIDATION);
        verifyNoInteractions(reservationService);
    }

    @Test
    void missingPlanFailsWithoutRetry() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.empty());

        JobOutcome.Failure outcome = (JobOutcome.Failure) handler.processJob(
                job("{\"planId\":\"" + planId + "\"}"), CancellationToken.NONE);

        assertThat(outcome.classification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(outcome.retryable()).isFalse();
    }

    @Test
    void payloadForAnotherPlanIsRejected() {
        JobOutcome.Failure outcome = (JobOutcome.Failure) handler.processJob(
                job("{\"planId\":\"" + UUID.randomUUID() + "\"}"), CancellationToken.NONE);

        assertThat(outcome.classification()).isEqualTo(FailureClassification.VALIDATION);
        verifyNoInteractions(planRepository, reservationService);
    }

    private PlanEntity storedPlan() {
        PlanEntity plan = new PlanEntity();
        plan.setId(planId);
        plan.setUserId(userId);
        plan.setTopic("Rust ownership");
        plan.setNotes("Focus on lifetimes");
        plan.setSkillLevel(SkillLevel.BEGINNER);
        plan.setWeeklyHours(4);
        plan.setLearningStyle(LearningStyle.READING);
        plan.setStartDate(LocalDate.of(2026, 2, 1));
        plan.setGenerationStatus(PlanGenerationStatus.READY);
        return plan;
    }

    private GenerationInput storedInput(int weeklyHours) {
        return new GenerationInput("Rust ownership", "Focus on lifetimes", SkillLevel.BEGINNER, weeklyHours,
                LearningStyle.READING, LocalDate.of(2026, 2, 1), null);
    }

    private JobEntity job(String payload) {
        JobEntity job = new JobEntity();
        job.setId(UUID.randomUUID());
        job.setType(JobType.PLAN_REGENERATION);
        job.setPlanId(planId);
        job.setUserId(userId);
        job.setStatus(JobStatus.PROCESSING);
        job.setAttempts(0);
        job.setMaxAttempts(3);
        job.setPayload(payload);
        return job;
    }
}
