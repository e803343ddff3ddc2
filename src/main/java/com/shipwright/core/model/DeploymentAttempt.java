package com.shipwright.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate root for one run of the pipeline against one environment.
 * <p>
 * Created when orchestration starts, appended to by each stage, and sealed
 * once a final status is set. Any append after sealing throws
 * {@link IllegalStateException}. Instances are never reused across attempts.
 */
public final class DeploymentAttempt {

    private final String attemptId;
    private final String environment;
    private final AttemptMode mode;
    private final Instant startedAt;

    private final List<StageRecord> stages = new ArrayList<>();
    private final List<AttemptStatus> statusHistory = new ArrayList<>();

    private Instant endedAt;
    private AttemptStatus finalStatus;
    private AttemptStatus failedGate;
    private String artifactTag;
    private String snapshotVersion;
    private ValidationReport validationReport;
    private SmokeTestReport smokeTestReport;
    private MonitoringResult monitoringResult;
    private RollbackResult rollbackResult;

    public DeploymentAttempt(String attemptId, String environment, AttemptMode mode, Instant startedAt) {
        this.attemptId = attemptId;
        this.environment = environment;
        this.mode = mode;
        this.startedAt = startedAt;
    }

    public void recordStage(StageRecord record) {
        ensureOpen();
        stages.add(record);
    }

    public void recordArtifactTag(String tag) {
        ensureOpen();
        this.artifactTag = tag;
    }

    public void recordSnapshotVersion(String versionId) {
        ensureOpen();
        this.snapshotVersion = versionId;
    }

    public void recordValidation(ValidationReport report) {
        ensureOpen();
        this.validationReport = report;
    }

    public void recordSmokeTests(SmokeTestReport report) {
        ensureOpen();
        this.smokeTestReport = report;
    }

    public void recordMonitoring(MonitoringResult result) {
        ensureOpen();
        this.monitoringResult = result;
    }

    public void recordRollback(RollbackResult result) {
        ensureOpen();
        this.rollbackResult = result;
    }

    /**
     * Marks the gate that failed before a rollback. The attempt stays open
     * until the rollback outcome seals it.
     */
    public void markGateFailed(AttemptStatus gate) {
        ensureOpen();
        this.failedGate = gate;
        statusHistory.add(gate);
    }

    public void seal(AttemptStatus status, Instant endedAt) {
        ensureOpen();
        if (failedGate == null && status != AttemptStatus.SUCCEEDED
                && status != AttemptStatus.ROLLED_BACK && status != AttemptStatus.ROLLBACK_FAILED) {
            failedGate = status;
        }
        this.finalStatus = status;
        this.endedAt = endedAt;
        statusHistory.add(status);
    }

    private void ensureOpen() {
        if (finalStatus != null) {
            throw new IllegalStateException("Attempt " + attemptId + " is sealed with status " + finalStatus);
        }
    }

    public boolean isSealed() {
        return finalStatus != null;
    }

    public boolean succeeded() {
        return finalStatus == AttemptStatus.SUCCEEDED;
    }

    public String attemptId() { return attemptId; }
    public String environment() { return environment; }
    public AttemptMode mode() { return mode; }
    public Instant startedAt() { return startedAt; }
    public Optional<Instant> endedAt() { return Optional.ofNullable(endedAt); }
    public AttemptStatus finalStatus() { return finalStatus; }
    public Optional<AttemptStatus> failedGate() { return Optional.ofNullable(failedGate); }
    public Optional<String> artifactTag() { return Optional.ofNullable(artifactTag); }
    public Optional<String> snapshotVersion() { return Optional.ofNullable(snapshotVersion); }
    public Optional<ValidationReport> validationReport() { return Optional.ofNullable(validationReport); }
    public Optional<SmokeTestReport> smokeTestReport() { return Optional.ofNullable(smokeTestReport); }
    public Optional<MonitoringResult> monitoringResult() { return Optional.ofNullable(monitoringResult); }
    public Optional<RollbackResult> rollbackResult() { return Optional.ofNullable(rollbackResult); }

    public List<StageRecord> stages() {
        return Collections.unmodifiableList(stages);
    }

    public List<AttemptStatus> statusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt != null ? endedAt : startedAt);
    }
}
