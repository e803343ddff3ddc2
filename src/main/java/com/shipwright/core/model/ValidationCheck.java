package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a single pre-deployment readiness check.
 *
 * @param name       check identifier (e.g. "tests", "environment")
 * @param passed     whether the check passed
 * @param message    human-readable summary
 * @param details    structured details; on internal failure carries an {@code error} entry
 * @param timestamp  when the check finished
 * @param durationMs how long the check took
 */
public record ValidationCheck(
    String name,
    boolean passed,
    String message,
    Map<String, Object> details,
    Instant timestamp,
    long durationMs
) implements Serializable {

    public ValidationCheck {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ValidationCheck passed(String name, String message, Map<String, Object> details, Instant timestamp) {
        return new ValidationCheck(name, true, message, details, timestamp, 0);
    }

    public static ValidationCheck failed(String name, String message, Map<String, Object> details, Instant timestamp) {
        return new ValidationCheck(name, false, message, details, timestamp, 0);
    }

    public ValidationCheck withDuration(long durationMs) {
        return new ValidationCheck(name, passed, message, details, timestamp, durationMs);
    }
}
