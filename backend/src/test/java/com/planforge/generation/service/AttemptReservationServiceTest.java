package com.planforge.generation.service;

import com.planforge.TestProperties;
import com.planforge.common.exception.NotFoundException;
import com.planforge.config.AppProperties;
import com.planforge.generation.model.AttemptStatus;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.model.GenerationAttemptEntity;
import com.planforge.generation.repo.GenerationAttemptRepository;
import com.planforge.plans.model.LearningStyle;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.model.SkillLevel;
import com.planforge.plans.repo.PlanModuleRepository;
import com.planforge.plans.repo.PlanRepository;
import com.planforge.ratelimit.RateLimitDecision;
import com.planforge.ratelimit.RateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AttemptReservationServiceTest {

    @Mock
    private PlanRepository planRepository;

    @Mock
    private PlanModuleRepository planModuleRepository;

    @Mock
    private GenerationAttemptRepository attemptRepository;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final UUID userId = UUID.randomUUID();

    @Test
    void reservesFirstAttemptAndMovesPlanToGenerating() {
        AttemptReservationService service = service(TestProperties.defaults());
        PlanEntity plan = plan(PlanGenerationStatus.PENDING);
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));
        when(attemptRepository.existsByPlanIdAndStatus(plan.getId(), AttemptStatus.PROCESSING)).thenReturn(false);
        when(attemptRepository.countByPlanId(plan.getId())).thenReturn(0L);
        when(rateLimiter.checkAndIncrement(userId)).thenReturn(RateLimitDecision.allow(9));
        when(attemptRepository.save(any(GenerationAttemptEntity.class))).thenAnswer(inv -> {
            GenerationAttemptEntity attempt = inv.getArgument(0);
            attempt.setId(UUID.randomUUID());
            attempt.setCreatedAt(Instant.now());
            return attempt;
        });

        AttemptReservation reservation = service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                PlanGenerationStatus.PENDING);

        assertThat(reservation.reserved()).isTrue();
        assertThat(reservation.attemptNumber()).isEqualTo(1);
        assertThat(reservation.attemptId()).isNotNull();
        assertThat(reservation.promptHash()).hasSize(64);
        assertThat(plan.getGenerationStatus()).isEqualTo(PlanGenerationStatus.GENERATING);
        verify(planRepository).save(plan);
    }

    @Test
    void truncatesLongInputBeforeHashing() {
        AppProperties properties = TestProperties.withGeneration(
                new AppProperties.Generation(3, 10, 5, Duration.ofSeconds(5), Duration.ofSeconds(10)));
        AttemptReservationService service = service(properties);
        PlanEntity plan = plan(PlanGenerationStatus.PENDING);
        plan.setNotes("a very long note");
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));
        when(attemptRepository.countByPlanId(plan.getId())).thenReturn(1L);
        when(rateLimiter.checkAndIncrement(userId)).thenReturn(RateLimitDecision.allow(9));
        ArgumentCaptor<GenerationAttemptEntity> saved = ArgumentCaptor.forClass(GenerationAttemptEntity.class);
        when(attemptRepository.save(saved.capture())).thenAnswer(inv -> inv.getArgument(0));

        AttemptReservation reservation = service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                PlanGenerationStatus.PENDING);

        assertThat(reservation.input().topic()).isEqualTo("Distribute");
        assertThat(reservation.input().notes()).isEqualTo("a ver");
        assertThat(saved.getValue().getAttemptNo()).isEqualTo(2);
        assertThat(saved.getValue().isTruncatedTopic()).isTrue();
        assertThat(saved.getValue().isTruncatedNotes()).isTrue();
    }

    @Test
    void attemptInFlightWinsOverEveryOtherCheck() {
        AttemptReservationService service = service(TestProperties.defaults());
        PlanEntity plan = plan(PlanGenerationStatus.GENERATING);
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));
        when(attemptRepository.existsByPlanIdAndStatus(plan.getId(), AttemptStatus.PROCESSING)).thenReturn(true);

        AttemptReservation reservation = service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                PlanGenerationStatus.PENDING);

        assertThat(reservation.reserved()).isFalse();
        assertThat(reservation.reason()).isEqualTo(ReservationRejection.IN_PROGRESS);
        verify(rateLimiter, never()).checkAndIncrement(any());
        verify(attemptRepository, never()).save(any());
    }

    @Test
    void capIsEnforced() {
        AttemptReservationService service = service(TestProperties.defaults());
        PlanEntity plan = plan(PlanGenerationStatus.FAILED);
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));
        when(attemptRepository.countByPlanId(plan.getId())).thenReturn(3L);

        AttemptReservation reservation = service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                PlanGenerationStatus.FAILED);

        assertThat(reservation.reason()).isEqualTo(ReservationRejection.CAPPED);
        verify(rateLimiter, never()).checkAndIncrement(any());
    }

    @Test
    void statusOutsideAllowedSetIsRejectedWithoutConsumingRateLimit() {
        AttemptReservationService service = service(TestProperties.defaults());
        PlanEntity plan = plan(PlanGenerationStatus.READY);
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));

        AttemptReservation reservation = service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                EnumSet.of(PlanGenerationStatus.PENDING, PlanGenerationStatus.GENERATING));

        assertThat(reservation.reason()).isEqualTo(ReservationRejection.INVALID_STATUS);
        assertThat(reservation.currentStatus()).isEqualTo(PlanGenerationStatus.READY);
        verify(rateLimiter, never()).checkAndIncrement(any());
    }

    @Test
    void rateLimitRejectionCarriesRetryAfter() {
        AttemptReservationService service = service(TestProperties.defaults());
        PlanEntity plan = plan(PlanGenerationStatus.FAILED);
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));
        when(rateLimiter.checkAndIncrement(userId)).thenReturn(RateLimitDecision.deny(42));

        AttemptReservation reservation = service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                PlanGenerationStatus.FAILED);

        assertThat(reservation.reason()).isEqualTo(ReservationRejection.RATE_LIMITED);
        assertThat(reservation.retryAfterSeconds()).isEqualTo(42L);
        assertThat(plan.getGenerationStatus()).isEqualTo(PlanGenerationStatus.FAILED);
    }

    @Test
    void planOwnedByAnotherUserIsNotFound() {
        AttemptReservationService service = service(TestProperties.defaults());
        PlanEntity plan = plan(PlanGenerationStatus.PENDING);
        plan.setUserId(UUID.randomUUID());
        when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));

        assertThatThrownBy(() -> service.reserve(plan.getId(), userId, GenerationInput.fromPlan(plan),
                PlanGenerationStatus.PENDING))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void finalizeFailureClosesProcessingAttempt() {
        AttemptReservationService service = service(TestProperties.defaults());
        GenerationAttemptEntity attempt = new GenerationAttemptEntity();
        attempt.setId(UUID.randomUUID());
        attempt.setStatus(AttemptStatus.PROCESSING);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));

        service.finalizeFailure(attempt.getId(), UUID.randomUUID(), FailureClassification.TIMEOUT, 1500,
                "timed out", new ProviderMetadata("openai", "gpt-4o-mini", 0, 0, 0));

        assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.FAILED);
        assertThat(attempt.getClassification()).isEqualTo(FailureClassification.TIMEOUT);
        assertThat(attempt.getErrorMessage()).isEqualTo("timed out");
        assertThat(attempt.getProviderModel()).isEqualTo("gpt-4o-mini");
        assertThat(attempt.getFinishedAt()).isNotNull();
        verify(attemptRepository).save(attempt);
    }

    @Test
    void finalizeFailureLeavesFinishedAttemptAlone() {
        AttemptReservationService service = service(TestProperties.defaults());
        GenerationAttemptEntity attempt = new GenerationAttemptEntity();
        attempt.setId(UUID.randomUUID());
        attempt.setStatus(AttemptStatus.SUCCEEDED);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));

        service.finalizeFailure(attempt.getId(), UUID.randomUUID(), FailureClassification.UNKNOWN, 0, "late", null);

        assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.SUCCEEDED);
        verify(attemptRepository, never()).save(any());
    }

    @Test
    void finalizeFailureNeverThrows() {
        AttemptReservationService service = service(TestProperties.defaults());
        UUID attemptId = UUID.randomUUID();
        when(attemptRepository.findById(attemptId)).thenThrow(new IllegalStateException("connection reset"));

        service.finalizeFailure(attemptId, UUID.randomUUID(), FailureClassification.UNKNOWN, 0, "boom", null);

        verify(attemptRepository).findById(attemptId);
    }

    private AttemptReservationService service(AppProperties properties) {
        return new AttemptReservationService(planRepository, planModuleRepository, attemptRepository, rateLimiter,
                properties, transactionManager, new SimpleMeterRegistry());
    }

    private PlanEntity plan(PlanGenerationStatus status) {
        PlanEntity plan = new PlanEntity();
        plan.setId(UUID.randomUUID());
        plan.setUserId(userId);
        plan.setTopic("Distributed systems");
        plan.setSkillLevel(SkillLevel.INTERMEDIATE);
        plan.setWeeklyHours(8);
        plan.setLearningStyle(LearningStyle.MIXED);
        plan.setGenerationStatus(status);
        return plan;
    }
}
