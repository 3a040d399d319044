package com.planforge.usage.repo;

import com.planforge.usage.model.AiUsageEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AiUsageEventRepository extends JpaRepository<AiUsageEventEntity, UUID> {

    List<AiUsageEventEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
