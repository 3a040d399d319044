package com.planforge.plans.model;

public enum LearningStyle {
    READING,
    VIDEO,
    PRACTICE,
    MIXED
}
