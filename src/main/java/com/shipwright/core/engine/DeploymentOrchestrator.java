package com.shipwright.core.engine;

import com.shipwright.config.EnvironmentProfileResolver;
import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.events.DeploymentEvent;
import com.shipwright.core.events.EventBus;
import com.shipwright.core.exception.ContainerRuntimeException;
import com.shipwright.core.exception.SnapshotPersistenceException;
import com.shipwright.core.logging.MdcContext;
import com.shipwright.core.metrics.DeploymentMetrics;
import com.shipwright.core.model.AttemptMode;
import com.shipwright.core.model.AttemptStatus;
import com.shipwright.core.model.DeploymentAttempt;
import com.shipwright.core.model.DeploymentSnapshot;
import com.shipwright.core.model.EnvironmentProfile;
import com.shipwright.core.model.PipelineStage;
import com.shipwright.core.model.RollbackResult;
import com.shipwright.core.model.SmokeTestResult;
import com.shipwright.core.model.StageRecord;
import com.shipwright.core.model.ValidationCheck;
import com.shipwright.core.monitor.DeploymentMonitor;
import com.shipwright.core.rollback.RollbackAgent;
import com.shipwright.core.smoke.SmokeTestRunner;
import com.shipwright.core.validation.PreDeploymentValidator;
import com.shipwright.runtime.ContainerInfo;
import com.shipwright.runtime.ContainerRuntime;
import com.shipwright.runtime.ContainerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Drives one deployment attempt through the gated pipeline:
 * <pre>
 * PENDING → VALIDATING → BUILDING → STATE_SAVED → DEPLOYING → SMOKE_TESTING → MONITORING → SUCCEEDED
 * </pre>
 * A failed stage halts forward progress. Smoke or monitor failures (and a
 * deadline expiring once the old state has been saved) trigger exactly one
 * rollback to the pre-deploy snapshot, followed by an independent verification.
 * <p>
 * The environment lock is held from profile resolution until the attempt is sealed.
 */
@Service
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    private final ShipwrightProperties properties;
    private final EnvironmentProfileResolver profileResolver;
    private final EnvironmentLock environmentLock;
    private final PreDeploymentValidator validator;
    private final ContainerRuntime containerRuntime;
    private final SmokeTestRunner smokeTestRunner;
    private final DeploymentMonitor monitor;
    private final RollbackAgent rollbackAgent;
    private final EventBus eventBus;
    private final DeploymentMetrics metrics;
    private final Clock clock;

    public DeploymentOrchestrator(ShipwrightProperties properties,
                                  EnvironmentProfileResolver profileResolver,
                                  EnvironmentLock environmentLock,
                                  PreDeploymentValidator validator,
                                  ContainerRuntime containerRuntime,
                                  SmokeTestRunner smokeTestRunner,
                                  DeploymentMonitor monitor,
                                  RollbackAgent rollbackAgent,
                                  EventBus eventBus,
                                  DeploymentMetrics metrics,
                                  Clock clock) {
        this.properties = properties;
        this.profileResolver = profileResolver;
        this.environmentLock = environmentLock;
        this.validator = validator;
        this.containerRuntime = containerRuntime;
        this.smokeTestRunner = smokeTestRunner;
        this.monitor = monitor;
        this.rollbackAgent = rollbackAgent;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the full pipeline against {@code environment}.
     *
     * @throws com.shipwright.core.exception.UnknownEnvironmentException    if no profile exists
     * @throws com.shipwright.core.exception.DeploymentInProgressException if the environment is locked
     * @throws ContainerRuntimeException if the container engine is unreachable after validation
     */
    public DeploymentAttempt deploy(String environment, DeployOptions options) {
        Instant now = clock.instant();
        EnvironmentProfile profile = profileResolver.resolve(environment, now);
        String attemptId = "deploy_" + environment + "_" + now.getEpochSecond();

        try (var lock = environmentLock.acquire(environment)) {
            var attempt = new DeploymentAttempt(attemptId, environment, AttemptMode.DEPLOY, now);
            var ctx = new AttemptContext(attempt, profile, projectRoot(),
                    CancellationToken.withTimeout(clock, options.deadline()), clock);
            MdcContext.setAttempt(attemptId, environment);
            try {
                log.info("Starting deployment {} to {} (artifact {})", attemptId, environment, profile.artifactTag());
                publish(ctx, DeploymentEvent.ATTEMPT_STARTED, null,
                        Map.of("mode", AttemptMode.DEPLOY.name(), "artifactTag", profile.artifactTag(),
                                "skipBuild", options.skipBuild()));
                runPipeline(ctx, options);
                return attempt;
            } finally {
                MdcContext.clear();
            }
        }
    }

    /**
     * Validates (without the throwaway build) and smoke-tests the service that is
     * already running in {@code environment}. Nothing is built, deployed or rolled back.
     */
    public DeploymentAttempt quickDeploy(String environment) {
        Instant now = clock.instant();
        EnvironmentProfile profile = profileResolver.resolve(environment, now);
        String attemptId = "quick_" + environment + "_" + now.getEpochSecond();

        try (var lock = environmentLock.acquire(environment)) {
            var attempt = new DeploymentAttempt(attemptId, environment, AttemptMode.QUICK, now);
            var ctx = new AttemptContext(attempt, profile, projectRoot(), CancellationToken.none(clock), clock);
            MdcContext.setAttempt(attemptId, environment);
            try {
                log.info("Starting quick deployment check {} for {}", attemptId, environment);
                publish(ctx, DeploymentEvent.ATTEMPT_STARTED, null, Map.of("mode", AttemptMode.QUICK.name()));
                if (!validate(ctx, true)) {
                    finish(ctx, AttemptStatus.VALIDATION_FAILED);
                } else if (!smokeTest(ctx)) {
                    finish(ctx, AttemptStatus.SMOKE_FAILED);
                } else {
                    finish(ctx, AttemptStatus.SUCCEEDED);
                }
                return attempt;
            } finally {
                MdcContext.clear();
            }
        }
    }

    /**
     * Operator-initiated rollback to a saved snapshot, under that environment's lock.
     * The result is successful only if both the rollback and its verification succeed.
     */
    public RollbackResult rollbackTo(String versionId) {
        Optional<DeploymentSnapshot> snapshot = rollbackAgent.findSnapshot(versionId);
        if (snapshot.isEmpty()) {
            return rollbackAgent.rollback(versionId);
        }
        String environment = snapshot.get().environment();
        String attemptId = "rollback_" + versionId;
        try (var lock = environmentLock.acquire(environment)) {
            MdcContext.setAttempt(attemptId, environment);
            MdcContext.setStage(PipelineStage.ROLLING_BACK.name());
            try {
                eventBus.publish(new DeploymentEvent(DeploymentEvent.ROLLBACK_STARTED, attemptId, environment,
                        PipelineStage.ROLLING_BACK.name(), Map.of("versionId", versionId), clock.instant()));
                var result = rollbackAgent.rollback(versionId);
                var verified = result.withVerification(rollbackAgent.verify(versionId));
                metrics.recordRollback(verified.success());
                eventBus.publish(new DeploymentEvent(DeploymentEvent.ROLLBACK_COMPLETED, attemptId, environment,
                        PipelineStage.ROLLING_BACK.name(),
                        Map.of("versionId", versionId, "success", verified.success(), "message", verified.message()),
                        clock.instant()));
                return verified;
            } finally {
                MdcContext.clear();
            }
        }
    }

    private void runPipeline(AttemptContext ctx, DeployOptions options) {
        if (!validate(ctx, options.skipBuild())) {
            finish(ctx, AttemptStatus.VALIDATION_FAILED);
            return;
        }

        // Infrastructure fault, not a gate failure: propagate
        containerRuntime.ping();

        if (!build(ctx)) {
            finish(ctx, AttemptStatus.BUILD_FAILED);
            return;
        }
        if (!saveState(ctx)) {
            finish(ctx, AttemptStatus.DEPLOY_FAILED);
            return;
        }
        if (!deployArtifact(ctx)) {
            if (ctx.cancellation().isCancelled()) {
                rollbackAndFinish(ctx, AttemptStatus.DEPLOY_FAILED);
            } else {
                finish(ctx, AttemptStatus.DEPLOY_FAILED);
            }
            return;
        }
        if (!smokeTest(ctx)) {
            rollbackAndFinish(ctx, AttemptStatus.SMOKE_FAILED);
            return;
        }
        if (!monitorHealth(ctx)) {
            rollbackAndFinish(ctx, AttemptStatus.MONITOR_FAILED);
            return;
        }
        finish(ctx, AttemptStatus.SUCCEEDED);
    }

    private boolean validate(AttemptContext ctx, boolean skipBuild) {
        long start = beginStage(ctx, PipelineStage.VALIDATING);
        var report = validator.validate(ctx.projectRoot(), skipBuild);
        ctx.attempt().recordValidation(report);
        boolean passed = report.overallPassed();
        String message = passed
                ? report.passedChecks() + "/" + report.totalChecks() + " checks passed"
                : "Failed checks: " + String.join(", ", report.failures().stream().map(ValidationCheck::name).toList());
        return endStage(ctx, PipelineStage.VALIDATING, start, passed, message);
    }

    private boolean build(AttemptContext ctx) {
        long start = beginStage(ctx, PipelineStage.BUILDING);
        String tag = ctx.profile().artifactTag();
        try {
            var timeout = Duration.ofSeconds(properties.getValidator().getBuildTimeoutSeconds());
            String imageId = containerRuntime.buildImage(ctx.projectRoot(), tag, timeout);
            ctx.attempt().recordArtifactTag(tag);
            return endStage(ctx, PipelineStage.BUILDING, start, true, "Built " + tag + " (" + imageId + ")");
        } catch (ContainerRuntimeException e) {
            log.error("Build of {} failed", tag, e);
            return endStage(ctx, PipelineStage.BUILDING, start, false, e.getMessage());
        }
    }

    private boolean saveState(AttemptContext ctx) {
        long start = beginStage(ctx, PipelineStage.STATE_SAVED);
        var profile = ctx.profile();
        String versionId = "pre-" + ctx.attemptId();
        try {
            var current = runningContainer(profile);
            var snapshot = rollbackAgent.save(versionId,
                    current.map(ContainerInfo::image).orElse(""),
                    current.map(ContainerInfo::id).orElse(null),
                    profile,
                    properties.getRollback().isBackupData());
            ctx.attempt().recordSnapshotVersion(versionId);
            String message = snapshot.hasArtifact()
                    ? "Saved snapshot " + versionId + " of " + snapshot.artifactTag()
                    : "Saved snapshot " + versionId + " (nothing running)";
            return endStage(ctx, PipelineStage.STATE_SAVED, start, true, message);
        } catch (SnapshotPersistenceException | ContainerRuntimeException e) {
            log.error("Could not save pre-deploy state", e);
            return endStage(ctx, PipelineStage.STATE_SAVED, start, false, e.getMessage());
        }
    }

    private boolean deployArtifact(AttemptContext ctx) {
        long start = beginStage(ctx, PipelineStage.DEPLOYING);
        var profile = ctx.profile();
        try {
            for (var existing : existingContainers(profile)) {
                log.info("Stopping previous container {} ({})", existing.name(), existing.id());
                containerRuntime.stopAndRemove(existing.id());
            }
            String containerId = containerRuntime.runContainer(specFor(ctx));

            if (!ctx.cancellation().await(profile.startupGrace())) {
                return endStage(ctx, PipelineStage.DEPLOYING, start, false,
                        "Deploy interrupted: " + ctx.cancellation().reason().orElse("cancelled"));
            }
            if (!containerRuntime.isRunning(containerId)) {
                return endStage(ctx, PipelineStage.DEPLOYING, start, false,
                        "Container " + profile.containerName() + " exited during startup",
                        startupDiagnostics(containerId));
            }
            return endStage(ctx, PipelineStage.DEPLOYING, start, true,
                    "Deployed " + profile.artifactTag() + " on port " + profile.port());
        } catch (ContainerRuntimeException e) {
            log.error("Deploy of {} failed", profile.artifactTag(), e);
            return endStage(ctx, PipelineStage.DEPLOYING, start, false, e.getMessage());
        }
    }

    private Map<String, Object> startupDiagnostics(String containerId) {
        var details = new LinkedHashMap<String, Object>();
        details.put("containerId", containerId);
        try {
            String logs = containerRuntime.logs(containerId, properties.getDocker().getLogTail());
            details.put("containerLogs", logs != null ? logs : "");
        } catch (ContainerRuntimeException e) {
            log.warn("Could not read logs of container {}: {}", containerId, e.getMessage());
            details.put("logsError", e.getMessage());
        }
        return details;
    }

    private boolean smokeTest(AttemptContext ctx) {
        long start = beginStage(ctx, PipelineStage.SMOKE_TESTING);
        var report = smokeTestRunner.run(ctx.profile().smokeBaseUrl());
        ctx.attempt().recordSmokeTests(report);
        if (report.avgResponseTimeMs() > 0) {
            metrics.recordSmokeResponseTime(report.avgResponseTimeMs());
        }
        boolean passed = report.overallPassed();
        String message = passed
                ? report.passedTests() + "/" + report.totalTests() + " smoke tests passed"
                : "Failed smoke tests: " + String.join(", ", report.failures().stream().map(SmokeTestResult::testName).toList());
        return endStage(ctx, PipelineStage.SMOKE_TESTING, start, passed, message);
    }

    private boolean monitorHealth(AttemptContext ctx) {
        long start = beginStage(ctx, PipelineStage.MONITORING);
        var profile = ctx.profile();
        var result = monitor.monitor(ctx.attemptId(), profile.smokeBaseUrl(), profile.monitorWindow(),
                profile.monitorInterval(), profile.rollbackThreshold(), ctx.cancellation());
        ctx.attempt().recordMonitoring(result);
        metrics.recordHealthRate(result.healthRate());
        String message = result.cancelled()
                ? "Monitoring cancelled: " + result.cancellationReason()
                : String.format("Health rate %.3f over %d samples (threshold %.2f)",
                        result.healthRate(), result.sampleCount(), profile.rollbackThreshold());
        return endStage(ctx, PipelineStage.MONITORING, start, result.passed(), message);
    }

    private void rollbackAndFinish(AttemptContext ctx, AttemptStatus gate) {
        var attempt = ctx.attempt();
        attempt.markGateFailed(gate);
        String versionId = attempt.snapshotVersion().orElseThrow();

        long start = beginStage(ctx, PipelineStage.ROLLING_BACK);
        log.warn("{} - rolling back to {}", gate, versionId);
        publish(ctx, DeploymentEvent.ROLLBACK_STARTED, PipelineStage.ROLLING_BACK,
                Map.of("versionId", versionId, "reason", gate.wireName()));

        var result = rollbackAgent.rollback(versionId);
        var verified = result.withVerification(rollbackAgent.verify(versionId));
        attempt.recordRollback(verified);
        metrics.recordRollback(verified.success());

        endStage(ctx, PipelineStage.ROLLING_BACK, start, verified.success(), verified.message());
        publish(ctx, DeploymentEvent.ROLLBACK_COMPLETED, PipelineStage.ROLLING_BACK,
                Map.of("versionId", versionId, "success", verified.success(), "message", verified.message()));
        finish(ctx, verified.success() ? AttemptStatus.ROLLED_BACK : AttemptStatus.ROLLBACK_FAILED);
    }

    private void finish(AttemptContext ctx, AttemptStatus status) {
        var attempt = ctx.attempt();
        attempt.seal(status, clock.instant());
        metrics.recordAttempt(ctx.environment(), status.wireName());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", status.wireName());
        payload.put("durationMs", attempt.duration().toMillis());
        attempt.failedGate().ifPresent(g -> payload.put("failedGate", g.wireName()));
        publish(ctx, DeploymentEvent.ATTEMPT_COMPLETED, null, payload);

        if (attempt.succeeded()) {
            log.info("Attempt {} succeeded in {}s", attempt.attemptId(), attempt.duration().toSeconds());
        } else {
            log.warn("Attempt {} finished with status {}", attempt.attemptId(), status);
        }
    }

    private long beginStage(AttemptContext ctx, PipelineStage stage) {
        MdcContext.setStage(stage.name());
        log.info("Stage {} started", stage);
        publish(ctx, DeploymentEvent.STAGE_STARTED, stage, Map.of());
        return System.nanoTime();
    }

    /**
     * Records the stage outcome. A stage that passed but overran the attempt
     * deadline is recorded as failed.
     */
    private boolean endStage(AttemptContext ctx, PipelineStage stage, long startNanos, boolean passed, String message) {
        return endStage(ctx, stage, startNanos, passed, message, Map.of());
    }

    private boolean endStage(AttemptContext ctx, PipelineStage stage, long startNanos, boolean passed, String message,
                             Map<String, Object> details) {
        if (passed && stage != PipelineStage.ROLLING_BACK && ctx.cancellation().isCancelled()) {
            passed = false;
            message = "Stage " + stage + " aborted: " + ctx.cancellation().reason().orElse("cancelled");
        }
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        ctx.attempt().recordStage(new StageRecord(stage, passed, message, durationMs, clock.instant(), details));
        metrics.recordStage(stage.name(), passed, durationMs);
        publish(ctx, passed ? DeploymentEvent.STAGE_PASSED : DeploymentEvent.STAGE_FAILED, stage,
                Map.of("message", message != null ? message : "", "durationMs", durationMs));
        if (passed) {
            log.info("Stage {} passed in {}ms: {}", stage, durationMs, message);
        } else {
            log.warn("Stage {} failed in {}ms: {}", stage, durationMs, message);
        }
        return passed;
    }

    private void publish(AttemptContext ctx, String type, PipelineStage stage, Map<String, Object> payload) {
        eventBus.publish(new DeploymentEvent(type, ctx.attemptId(), ctx.environment(),
                stage != null ? stage.name() : null, payload, clock.instant()));
    }

    private Optional<ContainerInfo> runningContainer(EnvironmentProfile profile) {
        return containerRuntime.findContainer(profile.containerName())
                .filter(ContainerInfo::running)
                .or(() -> containerRuntime.findContainerByPort(profile.port()).filter(ContainerInfo::running));
    }

    private List<ContainerInfo> existingContainers(EnvironmentProfile profile) {
        var byName = containerRuntime.findContainer(profile.containerName());
        var byPort = containerRuntime.findContainerByPort(profile.port())
                .filter(c -> byName.map(n -> !n.id().equals(c.id())).orElse(true));
        return Stream.of(byName, byPort).flatMap(Optional::stream).toList();
    }

    private ContainerSpec specFor(AttemptContext ctx) {
        var profile = ctx.profile();
        return new ContainerSpec(
                profile.containerName(),
                profile.artifactTag(),
                profile.port(),
                profile.containerPort(),
                Map.of("ENVIRONMENT", profile.name(),
                        "API_HOST", "0.0.0.0",
                        "API_PORT", String.valueOf(profile.containerPort()),
                        "WORKERS", String.valueOf(profile.workerCount())),
                ctx.projectRoot().resolve(properties.getValidator().getDataDir()),
                properties.getDocker().getDataMountPath());
    }

    private Path projectRoot() {
        return Path.of(properties.getProjectRoot());
    }
}
