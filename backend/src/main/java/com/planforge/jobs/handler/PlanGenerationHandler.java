package com.planforge.jobs.handler;

import com.planforge.generation.service.AttemptReservationService;
import com.planforge.generation.service.GenerationExecutionPipeline;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.GenerationOutcomeService;
import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobType;
import com.planforge.plans.model.PlanGenerationStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * First generation of a newly created plan. A plan left GENERATING by a retryable failure is picked up
 * again when the job is redelivered.
 */
@Component
public class PlanGenerationHandler extends AbstractPlanJobHandler {

    private static final Set<PlanGenerationStatus> ALLOWED = EnumSet.of(
            PlanGenerationStatus.PENDING,
            PlanGenerationStatus.GENERATING
    );

    public PlanGenerationHandler(JobPayloadReader payloadReader,
                                 AttemptReservationService reservationService,
                                 GenerationExecutionPipeline executionPipeline,
                                 GenerationOutcomeService outcomeService) {
        super(payloadReader, reservationService, executionPipeline, outcomeService);
    }

    @Override
    public JobType type() {
        return JobType.PLAN_GENERATION;
    }

    @Override
    protected GenerationInput prepareInput(JobEntity job) {
        return payloadReader.read(job.getPayload(), GenerationJobPayload.class).toInput();
    }

    @Override
    protected Set<PlanGenerationStatus> allowedStatuses() {
        return ALLOWED;
    }
}
