package com.planforge.streaming;

import com.planforge.common.cancel.CancellationSource;
import com.planforge.common.exception.ApiException;
import com.planforge.common.exception.BadRequestException;
import com.planforge.common.exception.ConflictException;
import com.planforge.common.exception.TooManyRequestsException;
import com.planforge.config.AppProperties;
import com.planforge.generation.model.FailureClassification;
import com.planforge.generation.service.AttemptContext;
import com.planforge.generation.service.AttemptReservation;
import com.planforge.generation.service.AttemptReservationService;
import com.planforge.generation.service.GenerationExecutionPipeline;
import com.planforge.generation.service.GenerationInput;
import com.planforge.generation.service.GenerationOutcomeService;
import com.planforge.generation.service.GenerationResult;
import com.planforge.plans.dto.CreatePlanRequest;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.service.PlanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous generation over server-sent events. The attempt is reserved on the request thread so
 * rejections become plain HTTP errors; the generation itself runs on the stream executor.
 */
@Service
public class PlanStreamService {

    private static final Logger log = LoggerFactory.getLogger(PlanStreamService.class);
    // lets the pipeline send its own terminal event before the servlet container times out
    private static final Duration EMITTER_GRACE = Duration.ofSeconds(5);

    private final PlanService planService;
    private final AttemptReservationService reservationService;
    private final GenerationExecutionPipeline executionPipeline;
    private final GenerationOutcomeService outcomeService;
    private final StreamingEventPipeline streamingPipeline;
    private final ExecutorService streamExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final Duration streamTimeout;

    public PlanStreamService(PlanService planService,
                             AttemptReservationService reservationService,
                             GenerationExecutionPipeline executionPipeline,
                             GenerationOutcomeService outcomeService,
                             StreamingEventPipeline streamingPipeline,
                             @Qualifier("streamExecutor") ExecutorService streamExecutor,
                             @Qualifier("streamTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                             AppProperties appProperties) {
        this.planService = planService;
        this.reservationService = reservationService;
        this.executionPipeline = executionPipeline;
        this.outcomeService = outcomeService;
        this.streamingPipeline = streamingPipeline;
        this.streamExecutor = streamExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.streamTimeout = appProperties.generation().streamTimeout();
    }

    /**
     * Creates a plan and streams its first generation. A plan whose first attempt is refused is
     * marked FAILED so it can be retried later.
     */
    public SseEmitter createAndStream(UUID userId, CreatePlanRequest request) {
        PlanEntity plan = planService.createPlan(userId, request);
        AttemptReservation reservation = reservationService.reserve(
                plan.getId(), userId, GenerationInput.fromPlan(plan), PlanGenerationStatus.PENDING);
        if (!reservation.reserved()) {
            outcomeService.markPlanFailed(plan.getId());
            throw rejection(reservation);
        }
        return open(userId, reservation);
    }

    public SseEmitter retry(UUID userId, UUID planId) {
        PlanEntity plan = planService.getOwnedPlan(planId, userId);
        AttemptReservation reservation = reservationService.reserve(
                planId, userId, GenerationInput.fromPlan(plan), PlanGenerationStatus.FAILED);
        if (!reservation.reserved()) {
            throw rejection(reservation);
        }
        return open(userId, reservation);
    }

    static ApiException rejection(AttemptReservation reservation) {
        return switch (reservation.reason()) {
            case CAPPED -> new TooManyRequestsException("Generation attempt limit reached for this plan");
            case IN_PROGRESS -> new ConflictException("A generation for this plan is already running");
            case INVALID_STATUS -> new BadRequestException(
                    "Plan cannot be generated while " + reservation.currentStatus().name().toLowerCase(Locale.ROOT));
            case RATE_LIMITED -> new TooManyRequestsException(
                    "Too many generation requests", reservation.retryAfterSeconds());
        };
    }

    private SseEmitter open(UUID userId, AttemptReservation reservation) {
        UUID planId = reservation.planId();
        SseEmitter emitter = new SseEmitter(streamTimeout.plus(EMITTER_GRACE).toMillis());
        CancellationSource requestSource = new CancellationSource();
        CancellationSource streamSource = new CancellationSource();
        emitter.onCompletion(() -> {
            requestSource.cancel();
        });
        emitter.onTimeout(() -> {
            requestSource.cancel();
        });
        emitter.onError(error -> {
            requestSource.cancel();
        });

        SseEventSink sink = new SseEventSink(emitter, requestSource);
        StreamRun run = new StreamRun(
                planId,
                planStart(reservation),
                requestSource,
                streamSource,
                token -> executionPipeline.run(AttemptContext.of(reservation, userId), token),
                success -> {
                    outcomeService.recordSuccess(reservation, userId, success);
                    outcomeService.enrich(planId, reservation.input());
                },
                failure -> outcomeService.recordFailure(reservation, userId, failure, true),
                error -> outcomeService.recordFailure(reservation, userId, unexpected(error), true)
        );

        ScheduledFuture<?> deadline = timeoutScheduler.schedule(() -> {
            if (streamSource.cancel()) {
                log.info("Stream for plan {} hit its {} deadline", planId, streamTimeout);
            }
        }, streamTimeout.toMillis(), TimeUnit.MILLISECONDS);

        try {
            streamExecutor.execute(() -> {
                try {
                    streamingPipeline.run(sink, run);
                } finally {
                    deadline.cancel(false);
                    sink.complete();
                }
            });
        } catch (RejectedExecutionException exception) {
            deadline.cancel(false);
            log.error("Stream executor rejected plan {}", planId, exception);
            outcomeService.recordFailure(reservation, userId, unexpected(exception), true);
            throw exception;
        }
        return emitter;
    }

    private static GenerationResult.Failure unexpected(Throwable error) {
        return new GenerationResult.Failure(
                "Unexpected error: " + error.getClass().getSimpleName(),
                FailureClassification.UNKNOWN,
                0L,
                null
        );
    }

    private static Map<String, Object> planStart(AttemptReservation reservation) {
        GenerationInput input = reservation.input();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("planId", reservation.planId());
        data.put("attemptNumber", reservation.attemptNumber());
        data.put("topic", input.topic());
        data.put("skillLevel", input.skillLevel().name().toLowerCase(Locale.ROOT));
        data.put("learningStyle", input.learningStyle().name().toLowerCase(Locale.ROOT));
        data.put("weeklyHours", input.weeklyHours());
        data.put("startDate", input.startDate() == null ? null : input.startDate().toString());
        data.put("deadlineDate", input.deadlineDate() == null ? null : input.deadlineDate().toString());
        return data;
    }
}
