package com.planforge.plans.service;

import java.util.UUID;

/**
 * Final plan-level transitions after an attempt has run. Each call is a single-row update.
 */
public interface PlanStatusStore {

    void markSuccess(UUID planId);

    void markFailure(UUID planId);
}
