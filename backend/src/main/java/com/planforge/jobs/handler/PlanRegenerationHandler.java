package com.planforge.jobs.handler;

import com.planforge.generation.service.AttemptReservation;
import com.planforge.generation.service.AttemptReservationService;
import com.planforge.generation.service.GenerationExecutionPipeline;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.GenerationOutcomeService;
import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobType;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.repo.PlanRepository;
import com.planforge.plans.service.PlanOverrides;
import com.planforge.plans.service.PlanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

@Component
public class PlanRegenerationHandler extends AbstractPlanJobHandler {

    private static final Logger log = LoggerFactory.getLogger(PlanRegenerationHandler.class);
    private static final Set<PlanGenerationStatus> ALLOWED = EnumSet.of(
            PlanGenerationStatus.READY,
            PlanGenerationStatus.FAILED,
            PlanGenerationStatus.GENERATING
    );

    private final PlanRepository planRepository;
    private final PlanService planService;

    public PlanRegenerationHandler(JobPayloadReader payloadReader,
                                   AttemptReservationService reservationService,
                                   GenerationExecutionPipeline executionPipeline,
                                   GenerationOutcomeService outcomeService,
                                   PlanRepository planRepository,
                                   PlanService planService) {
        super(payloadReader, reservationService, executionPipeline, outcomeService);
        this.planRepository = planRepository;
        this.planService = planService;
    }

    @Override
    public JobType type() {
        return JobType.PLAN_REGENERATION;
    }

    @Override
    protected GenerationInput prepareInput(JobEntity job) {
        RegenerationJobPayload payload = payloadReader.read(job.getPayload(), RegenerationJobPayload.class);
        if (!payload.planId().equals(job.getPlanId())) {
            throw new InvalidJobPayloadException("Payload plan " + payload.planId() + " does not match job plan " + job.getPlanId());
        }
        PlanEntity plan = planRepository.findByIdAndUserId(job.getPlanId(), job.getUserId())
                .orElseThrow(() -> new InvalidJobPayloadException("Plan " + job.getPlanId() + " no longer exists"));
        return PlanOverrides.from(payload.overrides()).applyTo(plan);
    }

    @Override
    protected Set<PlanGenerationStatus> allowedStatuses() {
        return ALLOWED;
    }

    @Override
    protected void beforeGeneration(JobEntity job, AttemptReservation reservation) {
        planService.applyInputs(job.getPlanId(), reservation.input());
        log.debug("Stored merged inputs for plan {} ahead of regeneration", job.getPlanId());
    }
}
