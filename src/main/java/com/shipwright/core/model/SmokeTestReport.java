package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Aggregated smoke test results for one deployed endpoint.
 */
public record SmokeTestReport(
    String baseUrl,
    List<SmokeTestResult> results,
    Instant timestamp,
    long durationMs
) implements Serializable {

    public SmokeTestReport {
        results = List.copyOf(results);
    }

    public boolean overallPassed() {
        return results.stream().allMatch(SmokeTestResult::passed);
    }

    public int totalTests() {
        return results.size();
    }

    public int passedTests() {
        return (int) results.stream().filter(SmokeTestResult::passed).count();
    }

    public int failedTests() {
        return totalTests() - passedTests();
    }

    /** Mean response time over checks that got a response; timeouts are excluded. */
    public double avgResponseTimeMs() {
        return results.stream()
                .filter(SmokeTestResult::gotResponse)
                .mapToDouble(SmokeTestResult::responseTimeMs)
                .average()
                .orElse(0.0);
    }

    public List<SmokeTestResult> failures() {
        return results.stream().filter(r -> !r.passed()).toList();
    }
}
