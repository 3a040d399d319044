package com.planforge.plans.repo;

import com.planforge.plans.model.PlanModuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface PlanModuleRepository extends JpaRepository<PlanModuleEntity, UUID> {

    List<PlanModuleEntity> findByPlanIdOrderByPositionAsc(UUID planId);

    long countByPlanId(UUID planId);

    void deleteByPlanId(UUID planId);
}
