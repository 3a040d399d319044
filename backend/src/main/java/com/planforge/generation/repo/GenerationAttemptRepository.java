package com.planforge.generation.repo;

import com.planforge.generation.model.AttemptStatus;
import com.planforge.generation.model.GenerationAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GenerationAttemptRepository extends JpaRepository<GenerationAttemptEntity, UUID> {

    long countByPlanId(UUID planId);

    boolean existsByPlanIdAndStatus(UUID planId, AttemptStatus status);

    List<GenerationAttemptEntity> findByPlanIdOrderByAttemptNoDesc(UUID planId);

    Optional<GenerationAttemptEntity> findTopByPlanIdOrderByAttemptNoDesc(UUID planId);
}
