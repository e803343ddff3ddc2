package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Result of observing a deployment's health over a time window.
 * <p>
 * {@code cancellationReason} is set when monitoring was cut short by an
 * operator cancel or the attempt deadline; such a result never passes.
 */
public record MonitoringResult(
    String attemptId,
    boolean passed,
    long durationMs,
    int sampleCount,
    int failedCount,
    double avgResponseTimeMs,
    List<HealthSample> samples,
    String cancellationReason,
    Instant timestamp
) implements Serializable {

    public MonitoringResult {
        samples = List.copyOf(samples);
    }

    /**
     * Builds a result from the collected samples, deriving counts, the health
     * rate verdict and the mean response time of samples that got an answer.
     */
    public static MonitoringResult from(String attemptId, List<HealthSample> samples, double threshold,
                                        long durationMs, String cancellationReason, Instant timestamp) {
        int failed = (int) samples.stream().filter(s -> !s.healthy()).count();
        double rate = healthRate(samples.size(), failed);
        double avg = samples.stream()
                .filter(s -> s.responseTimeMs() > 0)
                .mapToDouble(HealthSample::responseTimeMs)
                .average()
                .orElse(0.0);
        boolean passed = cancellationReason == null && rate >= threshold;
        return new MonitoringResult(attemptId, passed, durationMs, samples.size(), failed, avg,
                samples, cancellationReason, timestamp);
    }

    public static double healthRate(int sampleCount, int failedCount) {
        if (sampleCount == 0) {
            return 0.0;
        }
        return (double) (sampleCount - failedCount) / sampleCount;
    }

    public double healthRate() {
        return healthRate(sampleCount, failedCount);
    }

    public boolean cancelled() {
        return cancellationReason != null;
    }
}
