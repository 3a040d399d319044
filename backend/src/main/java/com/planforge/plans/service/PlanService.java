package com.planforge.plans.service;

import com.planforge.common.exception.NotFoundException;
import com.planforge.generation.service.GenerationInput;
import com.planforge.plans.dto.CreatePlanRequest;
import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import com.planforge.plans.repo.PlanModuleRepository;
import com.planforge.plans.repo.PlanRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class PlanService {

    private final PlanRepository planRepository;
    private final PlanModuleRepository planModuleRepository;

    public PlanService(PlanRepository planRepository, PlanModuleRepository planModuleRepository) {
        this.planRepository = planRepository;
        this.planModuleRepository = planModuleRepository;
    }

    @Transactional
    public PlanEntity createPlan(UUID userId, CreatePlanRequest request) {
        PlanEntity plan = new PlanEntity();
        plan.setUserId(userId);
        plan.setTopic(request.topic().trim());
        plan.setNotes(request.notes());
        plan.setSkillLevel(request.skillLevel());
        plan.setWeeklyHours(request.weeklyHours());
        plan.setLearningStyle(request.learningStyle());
        plan.setStartDate(request.startDate());
        plan.setDeadlineDate(request.deadlineDate());
        plan.setGenerationStatus(PlanGenerationStatus.PENDING);
        return planRepository.save(plan);
    }

    @Transactional(readOnly = true)
    public PlanEntity getOwnedPlan(UUID planId, UUID userId) {
        return planRepository.findByIdAndUserId(planId, userId)
                .orElseThrow(() -> new NotFoundException("Plan not found"));
    }

    @Transactional(readOnly = true)
    public long countModules(UUID planId) {
        return planModuleRepository.countByPlanId(planId);
    }

    /**
     * Stores the inputs a regeneration actually ran with.
     */
    @Transactional
    public void applyInputs(UUID planId, GenerationInput input) {
        PlanEntity plan = planRepository.findById(planId)
                .orElseThrow(() -> new NotFoundException("Plan not found"));
        plan.setTopic(input.topic());
        plan.setNotes(input.notes());
        plan.setSkillLevel(input.skillLevel());
        plan.setWeeklyHours(input.weeklyHours());
        plan.setLearningStyle(input.learningStyle());
        plan.setStartDate(input.startDate());
        plan.setDeadlineDate(input.deadlineDate());
        planRepository.save(plan);
    }
}
