package com.planforge.plans.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.planforge.common.exception.BadRequestException;
import com.planforge.common.exception.TooManyRequestsException;
import com.planforge.config.AppProperties;
import com.planforge.generation.service.AttemptReservationService;
import com.planforge.generation.service.GenerationInput;
import com.planforge.jobs.dto.JobResponse;
import com.planforge.jobs.handler.GenerationJobPayload;
import com.planforge.jobs.handler.RegenerationJobPayload;
import com.planforge.jobs.model.JobType;
import com.planforge.jobs.service.JobStore;
import com.planforge.plans.dto.AttemptResponse;
import com.planforge.plans.dto.CreatePlanRequest;
import com.planforge.plans.dto.PlanAcceptedResponse;
import com.planforge.plans.dto.PlanStatusResponse;
import com.planforge.plans.model.PlanEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Queue-backed plan operations: creating a plan with its generation job, requesting a regeneration,
 * and reading back plan and job state.
 */
@Service
public class PlanWorkflowService {

    static final int GENERATION_PRIORITY = 10;
    static final int REGENERATION_PRIORITY = 0;
    static final String ACCEPTED_STATUS = "pending";

    private static final Logger log = LoggerFactory.getLogger(PlanWorkflowService.class);
    private static final Duration QUOTA_WINDOW = Duration.ofDays(1);

    private final PlanService planService;
    private final JobStore jobStore;
    private final AttemptReservationService reservationService;
    private final AppProperties appProperties;

    public PlanWorkflowService(PlanService planService,
                               JobStore jobStore,
                               AttemptReservationService reservationService,
                               AppProperties appProperties) {
        this.planService = planService;
        this.jobStore = jobStore;
        this.reservationService = reservationService;
        this.appProperties = appProperties;
    }

    @Transactional
    public PlanAcceptedResponse submitPlan(UUID userId, CreatePlanRequest request) {
        PlanEntity plan = planService.createPlan(userId, request);
        GenerationJobPayload payload = GenerationJobPayload.from(GenerationInput.fromPlan(plan));
        UUID jobId = jobStore.enqueue(JobType.PLAN_GENERATION, plan.getId(), userId, payload, GENERATION_PRIORITY);
        return new PlanAcceptedResponse(plan.getId(), jobId, ACCEPTED_STATUS);
    }

    /**
     * Queues a regeneration. Overrides are validated here so a bad request never reaches the queue;
     * the handler applies them again against the plan as it is when the job runs.
     */
    public PlanAcceptedResponse requestRegeneration(UUID userId, UUID planId, JsonNode overrides) {
        PlanEntity plan = planService.getOwnedPlan(planId, userId);
        try {
            PlanOverrides.from(overrides).applyTo(plan);
        } catch (InvalidPlanInputException exception) {
            throw new BadRequestException(exception.getMessage());
        }

        int dailyLimit = appProperties.jobs().regenerationDailyLimit();
        long used = jobStore.countUserJobsSince(userId, JobType.PLAN_REGENERATION, Instant.now().minus(QUOTA_WINDOW));
        if (used >= dailyLimit) {
            log.info("User {} reached the regeneration quota ({}/{})", userId, used, dailyLimit);
            throw new TooManyRequestsException("Daily regeneration limit reached");
        }

        UUID jobId = jobStore.enqueue(
                JobType.PLAN_REGENERATION,
                planId,
                userId,
                new RegenerationJobPayload(planId, overrides),
                REGENERATION_PRIORITY
        );
        return new PlanAcceptedResponse(planId, jobId, ACCEPTED_STATUS);
    }

    @Transactional(readOnly = true)
    public PlanStatusResponse status(UUID userId, UUID planId) {
        PlanEntity plan = planService.getOwnedPlan(planId, userId);
        List<AttemptResponse> attempts = reservationService.listAttempts(planId).stream()
                .map(attempt -> new AttemptResponse(
                        attempt.getId(),
                        attempt.getAttemptNo(),
                        attempt.getStatus(),
                        attempt.getClassification(),
                        attempt.getDurationMs(),
                        attempt.getModulesCount(),
                        attempt.getTasksCount(),
                        attempt.getCreatedAt(),
                        attempt.getFinishedAt()))
                .toList();
        JobResponse latestJob = jobStore.findByPlan(planId).stream()
                .findFirst()
                .map(JobResponse::from)
                .orElse(null);
        return new PlanStatusResponse(
                plan.getId(),
                plan.getTopic(),
                plan.getGenerationStatus(),
                plan.getFinalizedAt(),
                planService.countModules(planId),
                attempts,
                latestJob
        );
    }

    @Transactional(readOnly = true)
    public List<JobResponse> jobs(UUID userId, UUID planId) {
        planService.getOwnedPlan(planId, userId);
        return jobStore.findByPlan(planId).stream()
                .map(JobResponse::from)
                .toList();
    }
}
