package com.shipwright.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an attempt runs; delivered to bus subscribers and the JSONL event log.
 *
 * @param eventType   e.g. "attempt.started", "stage.failed", "rollback.completed"
 * @param attemptId   the attempt this event belongs to
 * @param environment target environment
 * @param stage       pipeline stage (nullable for attempt-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record DeploymentEvent(
    String eventType,
    String attemptId,
    String environment,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String ATTEMPT_STARTED = "attempt.started";
    public static final String STAGE_STARTED = "stage.started";
    public static final String STAGE_PASSED = "stage.passed";
    public static final String STAGE_FAILED = "stage.failed";
    public static final String ROLLBACK_STARTED = "rollback.started";
    public static final String ROLLBACK_COMPLETED = "rollback.completed";
    public static final String ATTEMPT_COMPLETED = "attempt.completed";

    public DeploymentEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
