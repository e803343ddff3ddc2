package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One health poll of a deployed service.
 */
public record HealthSample(
    Instant timestamp,
    Status status,
    double responseTimeMs,
    boolean ready,
    String error
) implements Serializable {

    public enum Status { HEALTHY, UNHEALTHY, ERROR }

    public boolean healthy() {
        return status == Status.HEALTHY;
    }
}
