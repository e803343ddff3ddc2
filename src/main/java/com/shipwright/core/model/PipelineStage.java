package com.shipwright.core.model;

/**
 * Working states of the deployment state machine. Terminal states are
 * expressed as {@link AttemptStatus}.
 */
public enum PipelineStage {
    PENDING,
    VALIDATING,
    BUILDING,
    STATE_SAVED,
    DEPLOYING,
    SMOKE_TESTING,
    MONITORING,
    ROLLING_BACK
}
