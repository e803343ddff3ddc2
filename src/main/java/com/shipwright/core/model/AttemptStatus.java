package com.shipwright.core.model;

/**
 * Terminal (or gate-failure) status of a deployment attempt.
 */
public enum AttemptStatus {
    SUCCEEDED,
    VALIDATION_FAILED,
    BUILD_FAILED,
    DEPLOY_FAILED,
    SMOKE_FAILED,
    MONITOR_FAILED,
    ROLLED_BACK,
    ROLLBACK_FAILED;

    public String wireName() {
        return name().toLowerCase();
    }
}
