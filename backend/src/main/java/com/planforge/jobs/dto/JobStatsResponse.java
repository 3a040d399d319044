package com.planforge.jobs.dto;

import com.planforge.jobs.service.JobStats;

import java.util.List;

public record JobStatsResponse(
        JobStats stats,
        List<JobResponse> recentFailures
) {
}
