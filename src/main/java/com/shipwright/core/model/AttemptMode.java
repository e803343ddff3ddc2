package com.shipwright.core.model;

/**
 * How an attempt was started: full pipeline, or validation plus smoke tests
 * against an already-running service.
 */
public enum AttemptMode {
    DEPLOY,
    QUICK
}
