package com.shipwright.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentMetricsTest {

    private SimpleMeterRegistry registry;
    private DeploymentMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DeploymentMetrics(registry);
    }

    @Test
    @DisplayName("recordStage records a timer by stage and outcome")
    void recordStage() {
        metrics.recordStage("BUILDING", true, 1500);
        metrics.recordStage("SMOKE_TESTING", false, 200);

        var building = registry.find("shipwright.stage.duration")
                .tag("stage", "BUILDING").tag("outcome", "passed").timer();
        var smoke = registry.find("shipwright.stage.duration")
                .tag("stage", "SMOKE_TESTING").tag("outcome", "failed").timer();

        assertNotNull(building);
        assertNotNull(smoke);
        assertEquals(1, building.count());
        assertEquals(1500.0, building.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordAttempt increments by environment and status")
    void recordAttempt() {
        metrics.recordAttempt("production", "succeeded");
        metrics.recordAttempt("production", "succeeded");
        metrics.recordAttempt("production", "rolled_back");

        var succeeded = registry.find("shipwright.attempts.total")
                .tag("environment", "production").tag("status", "succeeded").counter();
        var rolledBack = registry.find("shipwright.attempts.total")
                .tag("status", "rolled_back").counter();

        assertNotNull(succeeded);
        assertNotNull(rolledBack);
        assertEquals(2.0, succeeded.count());
        assertEquals(1.0, rolledBack.count());
    }

    @Test
    @DisplayName("recordRollback increments by result")
    void recordRollback() {
        metrics.recordRollback(true);
        metrics.recordRollback(false);
        metrics.recordRollback(false);

        assertEquals(1.0, registry.find("shipwright.rollbacks.total").tag("result", "success").counter().count());
        assertEquals(2.0, registry.find("shipwright.rollbacks.total").tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("smoke response time and health rate are distribution summaries")
    void summaries() {
        metrics.recordSmokeResponseTime(42.5);
        metrics.recordHealthRate(0.95);
        metrics.recordHealthRate(1.0);

        var smoke = registry.find("shipwright.smoke.response_time").summary();
        var health = registry.find("shipwright.monitor.health_rate").summary();
        assertNotNull(smoke);
        assertNotNull(health);
        assertEquals(1, smoke.count());
        assertEquals(2, health.count());
        assertEquals(1.0, health.max());
    }

    @Test
    @DisplayName("summary renders one sorted line per meter")
    void summary() {
        metrics.recordStage("BUILDING", true, 1500);
        metrics.recordAttempt("staging", "succeeded");
        metrics.recordHealthRate(0.95);
        registry.counter("jvm.unrelated").increment();

        assertEquals(List.of(
                "shipwright.attempts.total{environment=staging,status=succeeded} count=1",
                "shipwright.monitor.health_rate count=1 mean=0.950 max=0.950",
                "shipwright.stage.duration{outcome=passed,stage=BUILDING} count=1 total=1500ms max=1500ms"),
                metrics.summary());
    }

    @Test
    @DisplayName("summary is empty before anything is recorded")
    void emptySummary() {
        assertTrue(metrics.summary().isEmpty());
    }
}
