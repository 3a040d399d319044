package com.planforge.plans.model;

public enum SkillLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
