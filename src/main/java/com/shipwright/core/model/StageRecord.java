package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One entry in an attempt's ordered stage log. {@code details} carries
 * diagnostics such as the container logs of a failed start.
 */
public record StageRecord(
    PipelineStage stage,
    boolean passed,
    String message,
    long durationMs,
    Instant timestamp,
    Map<String, Object> details
) implements Serializable {

    public StageRecord {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public StageRecord(PipelineStage stage, boolean passed, String message, long durationMs, Instant timestamp) {
        this(stage, passed, message, durationMs, timestamp, Map.of());
    }
}
