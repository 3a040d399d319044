package com.planforge.jobs.handler;

import com.planforge.common.cancel.CancellationToken;
import com.planforge.common.exception.NotFoundException;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.AttemptContext;
import com.planforge.generation.service.AttemptReservation;
import com.planforge.generation.service.AttemptReservationService;
import com.planforge.generation.service.GenerationExecutionPipeline;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.GenerationOutcomeService;
import com.planforge.generation.service.GenerationResult;
import com.planforge.generation.service.ProviderMetadata;
import com.planforge.generation.service.ReservationRejection;
import com.planforge.jobs.model.JobEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.service.InvalidPlanInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shared flow for plan jobs: validate payload, reserve an attempt, run the pipeline, then persist the
 * outcome. Subclasses only decide how the generation input is built and which plan states they accept.
 */
public abstract class AbstractPlanJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractPlanJobHandler.class);

    protected final JobPayloadReader payloadReader;
    private final AttemptReservationService reservationService;
    private final GenerationExecutionPipeline executionPipeline;
    private final GenerationOutcomeService outcomeService;

    protected AbstractPlanJobHandler(JobPayloadReader payloadReader,
                                     AttemptReservationService reservationService,
                                     GenerationExecutionPipeline executionPipeline,
                                     GenerationOutcomeService outcomeService) {
        this.payloadReader = payloadReader;
        this.reservationService = reservationService;
        this.executionPipeline = executionPipeline;
        this.outcomeService = outcomeService;
    }

    /**
     * Builds the generation input from the job.
     *
     * @throws InvalidJobPayloadException when the payload can never be processed
     */
    protected abstract GenerationInput prepareInput(JobEntity job);

    protected abstract Set<PlanGenerationStatus> allowedStatuses();

    /**
     * Runs once the attempt is reserved, before the provider is called. A thrown exception fails the
     * attempt like any other unexpected error.
     */
    protected void beforeGeneration(JobEntity job, AttemptReservation reservation) {
    }

    @Override
    public final JobOutcome processJob(JobEntity job, CancellationToken cancellationToken) {
        if (job.getType() != type()) {
            return JobOutcome.failure("Handler for " + type() + " cannot process " + job.getType(),
                    FailureClassification.UNKNOWN, false);
        }
        if (job.getPlanId() == null) {
            return JobOutcome.failure("Job has no plan reference", FailureClassification.VALIDATION, false);
        }

        GenerationInput input;
        AttemptReservation reservation;
        try {
            input = prepareInput(job);
            reservation = reservationService.reserve(job.getPlanId(), job.getUserId(), input, allowedStatuses());
        } catch (InvalidJobPayloadException | InvalidPlanInputException exception) {
            log.warn("Job {} has an unusable payload: {}", job.getId(), exception.getMessage());
            return JobOutcome.failure(exception.getMessage(), FailureClassification.VALIDATION, false);
        } catch (NotFoundException exception) {
            log.warn("Job {} references missing plan {}", job.getId(), job.getPlanId());
            return JobOutcome.failure("Plan " + job.getPlanId() + " no longer exists", FailureClassification.VALIDATION, false);
        }

        if (!reservation.reserved()) {
            return rejected(job, reservation);
        }

        AttemptContext context = AttemptContext.of(reservation, job.getUserId());
        try {
            beforeGeneration(job, reservation);
            GenerationResult result = executionPipeline.run(context, cancellationToken);
            if (result instanceof GenerationResult.Success success) {
                outcomeService.enrich(job.getPlanId(), reservation.input());
                outcomeService.recordSuccess(reservation, job.getUserId(), success);
                return JobOutcome.success(summary(job, success));
            }

            GenerationResult.Failure failure = (GenerationResult.Failure) result;
            boolean retryable = failure.classification().isRetryable();
            outcomeService.recordFailure(reservation, job.getUserId(), failure, !retryable || isFinalAttempt(job));
            return JobOutcome.failure(failure.error(), failure.classification(), retryable);
        } catch (RuntimeException exception) {
            log.error("Unexpected error while running job {} for plan {}", job.getId(), job.getPlanId(), exception);
            GenerationResult.Failure failure = new GenerationResult.Failure(
                    "Unexpected error: " + exception.getClass().getSimpleName(),
                    FailureClassification.UNKNOWN,
                    0L,
                    (ProviderMetadata) null
            );
            outcomeService.recordFailure(reservation, job.getUserId(), failure, isFinalAttempt(job));
            return JobOutcome.failure(failure.error(), FailureClassification.UNKNOWN, true);
        }
    }

    @Override
    public void onRetriesExhausted(JobEntity job) {
        if (job.getPlanId() == null) {
            return;
        }
        try {
            reservationService.failAbandonedPlan(job.getPlanId());
        } catch (RuntimeException exception) {
            log.error("Job {} ran out of attempts but plan {} could not be marked failed",
                    job.getId(), job.getPlanId(), exception);
        }
    }

    private static boolean isFinalAttempt(JobEntity job) {
        return job.getAttempts() + 1 >= job.getMaxAttempts();
    }

    private JobOutcome rejected(JobEntity job, AttemptReservation reservation) {
        ReservationRejection reason = reservation.reason();
        FailureClassification classification = reason.classification();
        return switch (reason) {
            case CAPPED -> {
                outcomeService.markPlanFailed(job.getPlanId());
                yield JobOutcome.failure("Attempt limit reached for plan " + job.getPlanId(), classification, false);
            }
            case IN_PROGRESS -> JobOutcome.failure(
                    "Another attempt is already running for plan " + job.getPlanId(), classification, false);
            case INVALID_STATUS -> JobOutcome.failure(
                    "Plan " + job.getPlanId() + " is " + reservation.currentStatus(), classification, false);
            case RATE_LIMITED -> JobOutcome.failure(
                    "Rate limited; retry after " + reservation.retryAfterSeconds() + "s", classification, true);
        };
    }

    private Map<String, Object> summary(JobEntity job, GenerationResult.Success success) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("planId", job.getPlanId());
        result.put("attemptId", success.attemptId());
        result.put("modulesCount", success.modules().size());
        result.put("tasksCount", success.tasksCount());
        result.put("durationMs", success.durationMs());
        if (success.providerMetadata() != null) {
            result.put("provider", success.providerMetadata().provider());
            result.put("model", success.providerMetadata().model());
        }
        return result;
    }
}
