package com.planforge.enrichment;

import com.planforge.plans.model.SkillLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Default enrichment until a curation backend is wired in; records the request only.
 */
@Service
public class LoggingEnrichmentService implements EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(LoggingEnrichmentService.class);

    @Override
    public void enrich(UUID planId, String topic, SkillLevel skillLevel) {
        log.info("Enrichment requested for plan {} ({} / {})", planId, topic, skillLevel);
    }
}
