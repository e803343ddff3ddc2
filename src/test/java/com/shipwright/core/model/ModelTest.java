package com.shipwright.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final Instant NOW = Instant.parse("2025-11-14T10:00:00Z");

    @Nested
    @DisplayName("ValidationReport")
    class ValidationReportTests {

        @Test
        @DisplayName("overallPassed is the AND of every check")
        void overallPassedIsConjunction() {
            var ok = ValidationCheck.passed("tests", "ok", Map.of(), NOW);
            var bad = ValidationCheck.failed("environment", "missing", Map.of(), NOW);

            assertTrue(new ValidationReport(List.of(ok, ok), List.of(), NOW, 5).overallPassed());
            assertFalse(new ValidationReport(List.of(ok, bad), List.of(), NOW, 5).overallPassed());
            assertFalse(new ValidationReport(List.of(bad, ok), List.of(), NOW, 5).overallPassed());
        }

        @Test
        @DisplayName("counts are derived from the checks")
        void countsDerived() {
            var report = new ValidationReport(List.of(
                    ValidationCheck.passed("tests", "ok", Map.of(), NOW),
                    ValidationCheck.failed("data_stores", "missing", Map.of(), NOW),
                    ValidationCheck.passed("environment", "ok", Map.of(), NOW)),
                    List.of("artifact_build"), NOW, 12);

            assertEquals(3, report.totalChecks());
            assertEquals(2, report.passedChecks());
            assertEquals(1, report.failedChecks());
            assertEquals("data_stores", report.failures().get(0).name());
            assertEquals(List.of("artifact_build"), report.skippedChecks());
        }

        @Test
        @DisplayName("skipped checks do not affect the verdict")
        void skippedChecksIgnored() {
            var report = new ValidationReport(List.of(ValidationCheck.passed("tests", "ok", Map.of(), NOW)),
                    List.of("artifact_build"), NOW, 1);
            assertTrue(report.overallPassed());
            assertTrue(report.check("artifact_build").isEmpty());
        }
    }

    @Nested
    @DisplayName("SmokeTestReport")
    class SmokeTestReportTests {

        @Test
        @DisplayName("average response time ignores checks without a response")
        void averageIgnoresTimeouts() {
            var report = new SmokeTestReport("http://localhost:8001", List.of(
                    new SmokeTestResult("health_endpoint", true, "ok", 20.0, 200, Map.of(), NOW),
                    new SmokeTestResult("metrics_endpoint", true, "ok", 40.0, 200, Map.of(), NOW),
                    new SmokeTestResult("batch_prediction", false, "timed out after 30s", null, null, Map.of(), NOW)),
                    NOW, 100);

            assertEquals(30.0, report.avgResponseTimeMs(), 0.001);
            assertFalse(report.overallPassed());
            assertEquals(1, report.failedTests());
        }
    }

    @Nested
    @DisplayName("MonitoringResult")
    class MonitoringResultTests {

        private List<HealthSample> samples(int total, int failures) {
            var list = new ArrayList<HealthSample>();
            for (int i = 0; i < total; i++) {
                var status = i < failures ? HealthSample.Status.UNHEALTHY : HealthSample.Status.HEALTHY;
                list.add(new HealthSample(NOW, status, 10.0, true, null));
            }
            return list;
        }

        @Test
        @DisplayName("20 samples with one failure pass a 0.95 threshold")
        void oneFailureInTwentyPasses() {
            var result = MonitoringResult.from("a1", samples(20, 1), 0.95, 1000, null, NOW);
            assertEquals(0.95, result.healthRate(), 1e-9);
            assertTrue(result.passed());
        }

        @Test
        @DisplayName("20 samples with two failures fail a 0.95 threshold")
        void twoFailuresInTwentyFails() {
            var result = MonitoringResult.from("a1", samples(20, 2), 0.95, 1000, null, NOW);
            assertEquals(0.90, result.healthRate(), 1e-9);
            assertFalse(result.passed());
        }

        @Test
        @DisplayName("no samples yields a zero health rate")
        void noSamples() {
            var result = MonitoringResult.from("a1", List.of(), 0.95, 0, null, NOW);
            assertEquals(0.0, result.healthRate());
            assertFalse(result.passed());
        }

        @Test
        @DisplayName("a cancelled window never passes")
        void cancelledNeverPasses() {
            var result = MonitoringResult.from("a1", samples(5, 0), 0.95, 10, "attempt deadline exceeded", NOW);
            assertTrue(result.cancelled());
            assertFalse(result.passed());
        }
    }

    @Nested
    @DisplayName("RollbackResult")
    class RollbackResultTests {

        @Test
        @DisplayName("verification failure overrides a successful rollback")
        void verificationIsAuthoritative() {
            var result = new RollbackResult(true, "Rolled back to v1", "c1", "v1", NOW, Map.of());
            var verified = result.withVerification(false);
            assertFalse(verified.success());
            assertEquals(false, verified.details().get("verified"));
            assertTrue(result.withVerification(true).success());
        }
    }

    @Nested
    @DisplayName("DeploymentAttempt")
    class DeploymentAttemptTests {

        @Test
        @DisplayName("sealing rejects further appends")
        void sealedAttemptRejectsAppends() {
            var attempt = new DeploymentAttempt("deploy_staging_1", "staging", AttemptMode.DEPLOY, NOW);
            attempt.recordStage(new StageRecord(PipelineStage.VALIDATING, false, "failed", 3, NOW));
            attempt.seal(AttemptStatus.VALIDATION_FAILED, NOW.plusSeconds(1));

            assertTrue(attempt.isSealed());
            assertEquals(AttemptStatus.VALIDATION_FAILED, attempt.failedGate().orElseThrow());
            assertThrows(IllegalStateException.class,
                    () -> attempt.recordStage(new StageRecord(PipelineStage.BUILDING, true, "ok", 1, NOW)));
            assertThrows(IllegalStateException.class,
                    () -> attempt.seal(AttemptStatus.SUCCEEDED, NOW));
        }

        @Test
        @DisplayName("gate failure followed by rollback keeps both statuses in order")
        void statusHistoryKeepsGateAndOutcome() {
            var attempt = new DeploymentAttempt("deploy_staging_1", "staging", AttemptMode.DEPLOY, NOW);
            attempt.markGateFailed(AttemptStatus.SMOKE_FAILED);
            attempt.seal(AttemptStatus.ROLLED_BACK, NOW.plusSeconds(30));

            assertEquals(List.of(AttemptStatus.SMOKE_FAILED, AttemptStatus.ROLLED_BACK), attempt.statusHistory());
            assertEquals(AttemptStatus.SMOKE_FAILED, attempt.failedGate().orElseThrow());
            assertEquals(AttemptStatus.ROLLED_BACK, attempt.finalStatus());
            assertEquals(30, attempt.duration().toSeconds());
        }

        @Test
        @DisplayName("a successful attempt has no failed gate")
        void successHasNoGate() {
            var attempt = new DeploymentAttempt("deploy_staging_1", "staging", AttemptMode.DEPLOY, NOW);
            attempt.seal(AttemptStatus.SUCCEEDED, NOW);
            assertTrue(attempt.succeeded());
            assertTrue(attempt.failedGate().isEmpty());
        }
    }
}
