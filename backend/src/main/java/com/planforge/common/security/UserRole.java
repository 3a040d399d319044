package com.planforge.common.security;

public enum UserRole {
    LEARNER,
    OPERATOR
}
