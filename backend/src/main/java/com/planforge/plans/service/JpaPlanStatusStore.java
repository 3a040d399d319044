package com.planforge.plans.service;

import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.repo.PlanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Service
public class JpaPlanStatusStore implements PlanStatusStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPlanStatusStore.class);

    private final PlanRepository planRepository;

    public JpaPlanStatusStore(PlanRepository planRepository) {
        this.planRepository = planRepository;
    }

    @Override
    @Transactional
    public void markSuccess(UUID planId) {
        update(planId, PlanGenerationStatus.READY);
    }

    @Override
    @Transactional
    public void markFailure(UUID planId) {
        update(planId, PlanGenerationStatus.FAILED);
    }

    private void update(UUID planId, PlanGenerationStatus status) {
        int updated = planRepository.updateGenerationStatus(planId, status, Instant.now());
        if (updated == 0) {
            log.warn("Plan {} vanished before it could be marked {}", planId, status);
        }
    }
}
