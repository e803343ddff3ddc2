package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one black-box smoke check.
 * <p>
 * {@code responseTimeMs} and {@code statusCode} are {@code null} when the
 * request never produced a response (timeout, connection refused).
 */
public record SmokeTestResult(
    String testName,
    boolean passed,
    String message,
    Double responseTimeMs,
    Integer statusCode,
    Map<String, Object> details,
    Instant timestamp
) implements Serializable {

    public SmokeTestResult {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean gotResponse() {
        return responseTimeMs != null;
    }
}
