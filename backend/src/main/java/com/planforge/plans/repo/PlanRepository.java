package com.planforge.plans.repo;

import com.planforge.plans.model.PlanEntity;
import com.planforge.plans.model.PlanGenerationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface PlanRepository extends JpaRepository<PlanEntity, UUID> {

    Optional<PlanEntity> findByIdAndUserId(UUID id, UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PlanEntity p where p.id = :id")
    Optional<PlanEntity> findByIdForUpdate(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PlanEntity p
               set p.generationStatus = :status,
                   p.finalizedAt = :finalizedAt,
                   p.updatedAt = :finalizedAt
             where p.id = :id
            """)
    int updateGenerationStatus(@Param("id") UUID id,
                               @Param("status") PlanGenerationStatus status,
                               @Param("finalizedAt") Instant finalizedAt);
}
