package com.planforge.enrichment;

import com.planforge.plans.model.SkillLevel;

import java.util.UUID;

/**
 * Attaches curated resources to a freshly generated plan. Best effort: callers log failures and carry on.
 */
public interface EnrichmentService {

    void enrich(UUID planId, String topic, SkillLevel skillLevel);
}
