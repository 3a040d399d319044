package com.planforge.usage.service;

public interface UsageRecorder {

    void recordUsage(UsageRecord record);
}
