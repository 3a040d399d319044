package com.planforge.jobs.model;

public enum JobType {
    PLAN_GENERATION,
    PLAN_REGENERATION
}
