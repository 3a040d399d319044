package com.planforge.generation.service;

import com.planforge.common.exception.NotFoundException;
import com.planforge.config.AppProperties;
import com.planforge.generation.model.AttemptStatus;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.model.GenerationAttemptEntity;
import com.planforge.generation.repo.GenerationAttemptRepository;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.model.PlanModuleEntity;
import com.planforge.plans.model.PlanTaskEntity;
import com.planforge.plans.repo.PlanModuleRepository;
import com.planforge.plans.repo.PlanRepository;
import com.planforge.ratelimit.RateLimitDecision;
import com.planforge.ratelimit.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the lifecycle of generation attempts. {@link #reserve} is the only way an attempt starts:
 * the plan row is locked for the whole check-and-insert so two callers can never both reserve.
 */
@Service
public class AttemptReservationService {

    private static final Logger log = LoggerFactory.getLogger(AttemptReservationService.class);
    private static final int MAX_ERROR_CHARS = 2000;
    private static final Set<PlanGenerationStatus> UNSETTLED_STATUSES =
            EnumSet.of(PlanGenerationStatus.PENDING, PlanGenerationStatus.GENERATING);

    private final PlanRepository planRepository;
    private final PlanModuleRepository planModuleRepository;
    private final GenerationAttemptRepository attemptRepository;
    private final RateLimiter rateLimiter;
    private final AppProperties appProperties;
    private final TransactionTemplate cleanupTransaction;
    private final MeterRegistry meterRegistry;

    public AttemptReservationService(PlanRepository planRepository,
                                     PlanModuleRepository planModuleRepository,
                                     GenerationAttemptRepository attemptRepository,
                                     RateLimiter rateLimiter,
                                     AppProperties appProperties,
                                     PlatformTransactionManager transactionManager,
                                     MeterRegistry meterRegistry) {
        this.planRepository = planRepository;
        this.planModuleRepository = planModuleRepository;
        this.attemptRepository = attemptRepository;
        this.rateLimiter = rateLimiter;
        this.appProperties = appProperties;
        this.cleanupTransaction = new TransactionTemplate(transactionManager);
        this.cleanupTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.meterRegistry = meterRegistry;
    }

    @Transactional
    public AttemptReservation reserve(UUID planId, UUID userId, GenerationInput input, PlanGenerationStatus requiredStatus) {
        return reserve(planId, userId, input, EnumSet.of(requiredStatus));
    }

    @Transactional
    public AttemptReservation reserve(UUID planId,
                                      UUID userId,
                                      GenerationInput input,
                                      Set<PlanGenerationStatus> allowedStatuses) {
        PlanEntity plan = planRepository.findByIdForUpdate(planId)
                .filter(candidate -> candidate.getUserId().equals(userId))
                .orElseThrow(() -> new NotFoundException("Plan not found"));
        PlanGenerationStatus currentStatus = plan.getGenerationStatus();

        if (attemptRepository.existsByPlanIdAndStatus(planId, AttemptStatus.PROCESSING)) {
            return reject(planId, ReservationRejection.IN_PROGRESS, currentStatus);
        }

        long attemptCount = attemptRepository.countByPlanId(planId);
        if (attemptCount >= appProperties.generation().attemptCap()) {
            return reject(planId, ReservationRejection.CAPPED, currentStatus);
        }

        if (!allowedStatuses.contains(currentStatus)) {
            return reject(planId, ReservationRejection.INVALID_STATUS, currentStatus);
        }

        RateLimitDecision decision = rateLimiter.checkAndIncrement(userId);
        if (!decision.allowed()) {
            meterRegistry.counter("generation.reservation.rejected", "reason", ReservationRejection.RATE_LIMITED.name()).increment();
            log.info("Reservation for plan {} rate limited; retry after {}s", planId, decision.retryAfterSeconds());
            return AttemptReservation.rateLimited(planId, currentStatus, decision.retryAfterSeconds());
        }

        String topic = truncate(input.topic().trim(), appProperties.generation().topicMaxChars());
        String notes = input.notes() == null ? null : truncate(input.notes().trim(), appProperties.generation().notesMaxChars());
        GenerationInput sanitized = new GenerationInput(
                topic,
                notes,
                input.skillLevel(),
                input.weeklyHours(),
                input.learningStyle(),
                input.startDate(),
                input.deadlineDate()
        );
        String promptHash = PromptHash.of(sanitized);

        GenerationAttemptEntity attempt = new GenerationAttemptEntity();
        attempt.setPlanId(planId);
        attempt.setAttemptNo((int) attemptCount + 1);
        attempt.setStatus(AttemptStatus.PROCESSING);
        attempt.setPromptHash(promptHash);
        attempt.setTruncatedTopic(topic.length() < input.topic().trim().length());
        attempt.setTruncatedNotes(notes != null && notes.length() < input.notes().trim().length());
        GenerationAttemptEntity saved = attemptRepository.save(attempt);

        plan.setGenerationStatus(PlanGenerationStatus.GENERATING);
        plan.setFinalizedAt(null);
        planRepository.save(plan);

        log.info("Reserved attempt {} (#{}) for plan {}", saved.getId(), saved.getAttemptNo(), planId);
        return AttemptReservation.reserved(planId, saved.getId(), saved.getAttemptNo(), sanitized, promptHash, saved.getCreatedAt());
    }

    /**
     * Replaces the plan's modules with the generated ones and closes the attempt as succeeded.
     * Plan status is left to the caller.
     */
    @Transactional
    public void finalizeSuccess(AttemptReservation reservation, GenerationResult.Success result) {
        UUID planId = reservation.planId();
        planModuleRepository.deleteByPlanId(planId);

        List<ParsedModule> modules = result.modules();
        for (int i = 0; i < modules.size(); i++) {
            ParsedModule parsed = modules.get(i);
            PlanModuleEntity module = new PlanModuleEntity();
            module.setPlanId(planId);
            module.setPosition(i);
            module.setTitle(parsed.title());
            module.setDescription(parsed.description());
            module.setEstimatedMinutes(parsed.estimatedMinutes());
            for (int j = 0; j < parsed.tasks().size(); j++) {
                ParsedTask parsedTask = parsed.tasks().get(j);
                PlanTaskEntity task = new PlanTaskEntity();
                task.setPosition(j);
                task.setTitle(parsedTask.title());
                task.setDescription(parsedTask.description());
                task.setEstimatedMinutes(parsedTask.estimatedMinutes());
                module.addTask(task);
            }
            planModuleRepository.save(module);
        }

        GenerationAttemptEntity attempt = attemptRepository.findById(reservation.attemptId())
                .orElseThrow(() -> new IllegalStateException("Attempt " + reservation.attemptId() + " disappeared"));
        attempt.setStatus(AttemptStatus.SUCCEEDED);
        attempt.setClassification(null);
        attempt.setDurationMs(result.durationMs());
        attempt.setModulesCount(modules.size());
        attempt.setTasksCount(result.tasksCount());
        applyProvider(attempt, result.providerMetadata());
        attempt.setFinishedAt(Instant.now());
        attemptRepository.save(attempt);
    }

    /**
     * Closes the attempt as failed. Runs on failure-cleanup paths, so its own errors are logged and
     * never thrown.
     */
    public void finalizeFailure(UUID attemptId,
                                UUID planId,
                                FailureClassification classification,
                                long durationMs,
                                String error,
                                ProviderMetadata metadata) {
        try {
            cleanupTransaction.executeWithoutResult(status -> attemptRepository.findById(attemptId).ifPresentOrElse(
                    attempt -> {
                        if (attempt.getStatus() != AttemptStatus.PROCESSING) {
                            log.debug("Attempt {} already {}; not marking failed", attemptId, attempt.getStatus());
                            return;
                        }
                        attempt.setStatus(AttemptStatus.FAILED);
                        attempt.setClassification(classification);
                        attempt.setDurationMs(durationMs);
                        attempt.setModulesCount(0);
                        attempt.setTasksCount(0);
                        attempt.setErrorMessage(truncate(error, MAX_ERROR_CHARS));
                        applyProvider(attempt, metadata);
                        attempt.setFinishedAt(Instant.now());
                        attemptRepository.save(attempt);
                    },
                    () -> log.warn("Attempt {} for plan {} not found while finalizing failure", attemptId, planId)));
        } catch (RuntimeException exception) {
            log.error("Unable to finalize failed attempt {} for plan {}", attemptId, planId, exception);
        }
    }

    /**
     * Fails a plan whose queued generation gave up before it produced modules. A plan that already
     * reached READY or FAILED, or that another attempt is still generating, is left untouched.
     *
     * @return true if the plan was moved to FAILED
     */
    @Transactional
    public boolean failAbandonedPlan(UUID planId) {
        Optional<PlanEntity> locked = planRepository.findByIdForUpdate(planId);
        if (locked.isEmpty()) {
            return false;
        }
        PlanEntity plan = locked.get();
        if (!UNSETTLED_STATUSES.contains(plan.getGenerationStatus())
                || attemptRepository.existsByPlanIdAndStatus(planId, AttemptStatus.PROCESSING)) {
            return false;
        }
        plan.setGenerationStatus(PlanGenerationStatus.FAILED);
        plan.setFinalizedAt(Instant.now());
        planRepository.save(plan);
        log.warn("Plan {} marked FAILED after its queued generation ran out of attempts", planId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<GenerationAttemptEntity> listAttempts(UUID planId) {
        return attemptRepository.findByPlanIdOrderByAttemptNoDesc(planId);
    }

    private AttemptReservation reject(UUID planId, ReservationRejection reason, PlanGenerationStatus currentStatus) {
        meterRegistry.counter("generation.reservation.rejected", "reason", reason.name()).increment();
        log.info("Reservation for plan {} rejected: {} (status {})", planId, reason, currentStatus);
        return AttemptReservation.rejected(planId, reason, currentStatus);
    }

    private void applyProvider(GenerationAttemptEntity attempt, ProviderMetadata metadata) {
        if (metadata == null) {
            return;
        }
        attempt.setProviderName(metadata.provider());
        attempt.setProviderModel(metadata.model());
    }

    private static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }
}
