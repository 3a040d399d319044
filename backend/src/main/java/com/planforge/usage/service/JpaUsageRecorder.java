package com.planforge.usage.service;

import com.planforge.usage.model.AiUsageEventEntity;
import com.planforge.usage.repo.AiUsageEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JpaUsageRecorder implements UsageRecorder {

    private final AiUsageEventRepository usageEventRepository;

    public JpaUsageRecorder(AiUsageEventRepository usageEventRepository) {
        this.usageEventRepository = usageEventRepository;
    }

    @Override
    @Transactional
    public void recordUsage(UsageRecord record) {
        AiUsageEventEntity event = new AiUsageEventEntity();
        event.setUserId(record.userId());
        event.setProvider(record.provider());
        event.setModel(record.model());
        event.setInputTokens(record.inputTokens());
        event.setOutputTokens(record.outputTokens());
        event.setCostCents(record.costCents());
        event.setKind(record.kind());
        usageEventRepository.save(event);
    }
}
