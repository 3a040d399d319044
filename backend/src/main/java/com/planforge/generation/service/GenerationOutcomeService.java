package com.planforge.generation.service;

import com.planforge.common.concurrent.BackgroundTaskSupervisor;
import com.planforge.config.AppProperties;
import com.planforge.enrichment.EnrichmentService;
import com.planforge.plans.service.PlanStatusStore;
import com.planforge.usage.service.CostCalculator;
import com.planforge.usage.service.UsageRecord;
import com.planforge.usage.service.UsageRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Persists what happened to an attempt. Shared by the job handlers and the live stream so both paths
 * end in the same plan transitions and usage records.
 */
@Service
public class GenerationOutcomeService {

    static final String USAGE_KIND = "plan";

    private static final Logger log = LoggerFactory.getLogger(GenerationOutcomeService.class);

    private final AttemptReservationService reservationService;
    private final PlanStatusStore planStatusStore;
    private final UsageRecorder usageRecorder;
    private final CostCalculator costCalculator;
    private final EnrichmentService enrichmentService;
    private final BackgroundTaskSupervisor backgroundTasks;
    private final AppProperties appProperties;
    private final TransactionTemplate transactionTemplate;

    public GenerationOutcomeService(AttemptReservationService reservationService,
                                    PlanStatusStore planStatusStore,
                                    UsageRecorder usageRecorder,
                                    CostCalculator costCalculator,
                                    EnrichmentService enrichmentService,
                                    BackgroundTaskSupervisor backgroundTasks,
                                    AppProperties appProperties,
                                    PlatformTransactionManager transactionManager) {
        this.reservationService = reservationService;
        this.planStatusStore = planStatusStore;
        this.usageRecorder = usageRecorder;
        this.costCalculator = costCalculator;
        this.enrichmentService = enrichmentService;
        this.backgroundTasks = backgroundTasks;
        this.appProperties = appProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public void recordSuccess(AttemptReservation reservation, UUID userId, GenerationResult.Success result) {
        transactionTemplate.executeWithoutResult(status -> {
            reservationService.finalizeSuccess(reservation, result);
            planStatusStore.markSuccess(reservation.planId());
        });
        log.info("Plan {} generated: {} modules, {} tasks in {} ms",
                reservation.planId(), result.modules().size(), result.tasksCount(), result.durationMs());
        recordUsage(userId, result.providerMetadata());
    }

    public void recordFailure(AttemptReservation reservation,
                              UUID userId,
                              GenerationResult.Failure failure,
                              boolean markPlanFailed) {
        reservationService.finalizeFailure(
                reservation.attemptId(),
                reservation.planId(),
                failure.classification(),
                failure.durationMs(),
                failure.error(),
                failure.providerMetadata()
        );
        if (markPlanFailed) {
            markPlanFailed(reservation.planId());
            recordUsage(userId, failure.providerMetadata());
        }
    }

    public void markPlanFailed(UUID planId) {
        try {
            planStatusStore.markFailure(planId);
        } catch (RuntimeException exception) {
            log.error("Unable to mark plan {} failed", planId, exception);
        }
    }

    public void enrich(UUID planId, GenerationInput input) {
        if (!appProperties.enrichment().enabled()) {
            return;
        }
        Runnable task = () -> enrichmentService.enrich(planId, input.topic(), input.skillLevel());
        if (!appProperties.enrichment().synchronous()) {
            backgroundTasks.submit("enrichment:" + planId, task);
            return;
        }
        try {
            task.run();
        } catch (RuntimeException exception) {
            log.warn("Enrichment failed for plan {}", planId, exception);
        }
    }

    private void recordUsage(UUID userId, ProviderMetadata metadata) {
        if (metadata == null || !metadata.hasUsage()) {
            return;
        }
        UsageRecord record = new UsageRecord(
                userId,
                metadata.provider(),
                metadata.model(),
                metadata.inputTokens(),
                metadata.outputTokens(),
                costCalculator.costCents(metadata.model(), metadata.inputTokens(), metadata.outputTokens()),
                USAGE_KIND
        );
        backgroundTasks.submit("usage:" + userId, () -> usageRecorder.recordUsage(record));
    }
}
