package com.shipwright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Centralised Micrometer metrics for deployment attempts.
 * <p>
 * The CLI is one-shot, so {@link #summary()} renders the meters for the console
 * summary; a long-lived host can bind any other registry instead.
 */
@Service
public class DeploymentMetrics {

    private static final String PREFIX = "shipwright.";

    private final MeterRegistry registry;

    public DeploymentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStage(String stage, boolean passed, long ms) {
        Timer.builder("shipwright.stage.duration")
                .tag("stage", stage)
                .tag("outcome", passed ? "passed" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAttempt(String environment, String status) {
        Counter.builder("shipwright.attempts.total")
                .tag("environment", environment)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRollback(boolean success) {
        Counter.builder("shipwright.rollbacks.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordSmokeResponseTime(double ms) {
        DistributionSummary.builder("shipwright.smoke.response_time")
                .baseUnit("milliseconds")
                .register(registry)
                .record(ms);
    }

    public void recordHealthRate(double rate) {
        DistributionSummary.builder("shipwright.monitor.health_rate")
                .description("Health rate observed over a monitoring window")
                .register(registry)
                .record(rate);
    }

    /**
     * One line per Shipwright meter, sorted by name and tags.
     */
    public List<String> summary() {
        return registry.getMeters().stream()
                .filter(m -> m.getId().getName().startsWith(PREFIX))
                .sorted(Comparator.comparing(DeploymentMetrics::label))
                .map(m -> label(m) + " " + describe(m))
                .toList();
    }

    private static String label(Meter meter) {
        var id = meter.getId();
        if (id.getTags().isEmpty()) {
            return id.getName();
        }
        return id.getName() + id.getTags().stream()
                .map(t -> t.getKey() + "=" + t.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }

    private static String describe(Meter meter) {
        if (meter instanceof Counter counter) {
            return String.format(Locale.ROOT, "count=%.0f", counter.count());
        }
        if (meter instanceof Timer timer) {
            return String.format(Locale.ROOT, "count=%d total=%.0fms max=%.0fms",
                    timer.count(), timer.totalTime(TimeUnit.MILLISECONDS), timer.max(TimeUnit.MILLISECONDS));
        }
        if (meter instanceof DistributionSummary dist) {
            return String.format(Locale.ROOT, "count=%d mean=%.3f max=%.3f", dist.count(), dist.mean(), dist.max());
        }
        return "";
    }
}
