package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ordered results of a validation run.
 * <p>
 * Only executed checks appear in {@link #checks()}; checks that were skipped
 * (e.g. the artifact build on fast paths) are listed by name in
 * {@link #skippedChecks()} and take no part in {@link #overallPassed()}.
 * The overall verdict and the counts are always derived from the checks.
 */
public record ValidationReport(
    List<ValidationCheck> checks,
    List<String> skippedChecks,
    Instant timestamp,
    long durationMs
) implements Serializable {

    public ValidationReport {
        checks = List.copyOf(checks);
        skippedChecks = skippedChecks != null ? List.copyOf(skippedChecks) : List.of();
    }

    public boolean overallPassed() {
        return checks.stream().allMatch(ValidationCheck::passed);
    }

    public int totalChecks() {
        return checks.size();
    }

    public int passedChecks() {
        return (int) checks.stream().filter(ValidationCheck::passed).count();
    }

    public int failedChecks() {
        return totalChecks() - passedChecks();
    }

    public List<ValidationCheck> failures() {
        return checks.stream().filter(c -> !c.passed()).toList();
    }

    public Optional<ValidationCheck> check(String name) {
        return checks.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
