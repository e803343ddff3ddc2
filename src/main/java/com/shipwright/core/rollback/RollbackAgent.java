package com.shipwright.core.rollback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.engine.CancellationToken;
import com.shipwright.core.exception.SnapshotPersistenceException;
import com.shipwright.core.model.DeploymentSnapshot;
import com.shipwright.core.model.EnvironmentProfile;
import com.shipwright.core.model.RollbackResult;
import com.shipwright.runtime.ContainerInfo;
import com.shipwright.runtime.ContainerRuntime;
import com.shipwright.runtime.ContainerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Saves what is running before a deployment and restores it on demand.
 * <p>
 * {@link #rollback(String)} and {@link #verify(String)} report problems as
 * values; only {@link #save} throws, because a deployment must not proceed
 * without a restorable snapshot.
 */
@Service
public class RollbackAgent {

    private static final Logger log = LoggerFactory.getLogger(RollbackAgent.class);

    private final SnapshotStore snapshotStore;
    private final DataBackupManager dataBackupManager;
    private final ContainerRuntime containerRuntime;
    private final ShipwrightProperties properties;
    private final Clock clock;

    @Autowired
    public RollbackAgent(ContainerRuntime containerRuntime, ObjectMapper objectMapper,
                         ShipwrightProperties properties, Clock clock) {
        this(new SnapshotStore(stateDir(properties), objectMapper),
                new DataBackupManager(dataDir(properties), stateDir(properties)),
                containerRuntime, properties, clock);
    }

    RollbackAgent(SnapshotStore snapshotStore, DataBackupManager dataBackupManager,
                  ContainerRuntime containerRuntime, ShipwrightProperties properties, Clock clock) {
        this.snapshotStore = snapshotStore;
        this.dataBackupManager = dataBackupManager;
        this.containerRuntime = containerRuntime;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Records the environment's current state under {@code versionId}.
     *
     * @param artifactTag  image currently serving, or blank when nothing is running
     * @param containerRef id of the running container, may be {@code null}
     * @param backupData   copy the data directory aside first
     * @throws SnapshotPersistenceException if the snapshot or the data backup cannot be written
     */
    public DeploymentSnapshot save(String versionId, String artifactTag, String containerRef,
                                   EnvironmentProfile profile, boolean backupData) {
        var now = clock.instant();
        String backupPath = null;
        if (backupData) {
            try {
                backupPath = dataBackupManager.backup(versionId, now.getEpochSecond()).toString();
            } catch (IOException e) {
                throw new SnapshotPersistenceException("Failed to back up data for snapshot " + versionId, e);
            }
        }
        var snapshot = new DeploymentSnapshot(versionId, now, profile.name(),
                artifactTag != null ? artifactTag : "", containerRef, profile.containerName(),
                profile.port(), profile.containerPort(), backupPath);
        snapshotStore.save(snapshot);
        return snapshot;
    }

    /**
     * Restores the environment to the snapshot's state. Never throws.
     */
    public RollbackResult rollback(String versionId) {
        log.info("Rolling back to snapshot {}", versionId);
        Optional<DeploymentSnapshot> found;
        try {
            found = findSnapshot(versionId);
        } catch (SnapshotPersistenceException e) {
            log.error("Cannot load snapshot {}", versionId, e);
            return RollbackResult.failure("Snapshot " + versionId + " unreadable: " + e.getMessage(),
                    "unknown", versionId, clock.instant());
        }
        if (found.isEmpty()) {
            log.warn("Snapshot {} not found", versionId);
            return RollbackResult.failure("Snapshot " + versionId + " not found", "unknown", versionId, clock.instant());
        }

        var snapshot = found.get();
        String previousRef = "none";
        var details = new LinkedHashMap<String, Object>();
        details.put("environment", snapshot.environment());
        details.put("artifactTag", snapshot.artifactTag());
        details.put("port", snapshot.port());
        try {
            var replaced = currentContainers(snapshot);
            if (!replaced.isEmpty()) {
                previousRef = replaced.get(0).id();
                for (var container : replaced) {
                    log.info("Stopping container {} ({})", container.name(), container.id());
                    containerRuntime.stopAndRemove(container.id());
                }
            }
            details.put("previousContainer", previousRef);

            if (snapshot.hasDataBackup()) {
                dataBackupManager.restore(Path.of(snapshot.dataBackupPath()));
                details.put("dataRestored", snapshot.dataBackupPath());
            }

            if (!snapshot.hasArtifact()) {
                log.info("Snapshot {} recorded no running service; environment left empty", versionId);
                return new RollbackResult(true, "Rolled back to " + versionId + " (no service running)",
                        previousRef, versionId, clock.instant(), details);
            }

            String containerId = containerRuntime.runContainer(specFor(snapshot));
            details.put("newContainer", containerId);
            if (!awaitRunning(containerId)) {
                return new RollbackResult(false, "Container from " + snapshot.artifactTag() + " did not start within "
                        + properties.getRollback().getStartTimeoutSeconds() + "s",
                        previousRef, versionId, clock.instant(), details);
            }
            log.info("Rolled back to {} ({})", versionId, snapshot.artifactTag());
            return new RollbackResult(true, "Rolled back to " + versionId, previousRef, versionId, clock.instant(), details);
        } catch (IOException | RuntimeException e) {
            log.error("Rollback to {} failed", versionId, e);
            details.put("error", String.valueOf(e.getMessage()));
            return new RollbackResult(false, "Rollback failed: " + e.getMessage(), previousRef, versionId,
                    clock.instant(), details);
        }
    }

    /**
     * Independently checks that the environment matches the snapshot: its
     * artifact is running on its port, or nothing is when the snapshot was empty.
     */
    public boolean verify(String versionId) {
        try {
            var snapshot = findSnapshot(versionId).orElse(null);
            if (snapshot == null) {
                log.warn("Cannot verify: snapshot {} not found", versionId);
                return false;
            }
            var onPort = containerRuntime.findContainerByPort(snapshot.port());
            boolean ok = snapshot.hasArtifact()
                    ? onPort.filter(ContainerInfo::running)
                            .filter(c -> snapshot.artifactTag().equals(c.image()))
                            .isPresent()
                    : onPort.isEmpty();
            log.info("Verification of {} {}", versionId, ok ? "passed" : "failed");
            return ok;
        } catch (RuntimeException e) {
            log.error("Verification of {} failed", versionId, e);
            return false;
        }
    }

    public Optional<DeploymentSnapshot> findSnapshot(String versionId) {
        return snapshotStore.find(versionId);
    }

    public List<DeploymentSnapshot> listSnapshots() {
        return snapshotStore.list();
    }

    private List<ContainerInfo> currentContainers(DeploymentSnapshot snapshot) {
        var containers = new LinkedHashSet<ContainerInfo>();
        containerRuntime.findContainerByPort(snapshot.port()).ifPresent(containers::add);
        if (snapshot.containerName() != null && !snapshot.containerName().isBlank()) {
            containerRuntime.findContainer(snapshot.containerName())
                    .filter(c -> containers.stream().noneMatch(known -> known.id().equals(c.id())))
                    .ifPresent(containers::add);
        }
        return List.copyOf(containers);
    }

    private ContainerSpec specFor(DeploymentSnapshot snapshot) {
        return new ContainerSpec(
                snapshot.containerName(),
                snapshot.artifactTag(),
                snapshot.port(),
                snapshot.containerPort(),
                Map.of("ENVIRONMENT", snapshot.environment(),
                        "API_PORT", String.valueOf(snapshot.containerPort())),
                dataDir(properties),
                properties.getDocker().getDataMountPath());
    }

    private boolean awaitRunning(String containerId) {
        var cfg = properties.getRollback();
        var timeout = CancellationToken.withTimeout(clock, Duration.ofSeconds(cfg.getStartTimeoutSeconds()));
        var poll = Duration.ofMillis(cfg.getPollIntervalMillis());
        while (true) {
            if (containerRuntime.isRunning(containerId)) {
                return true;
            }
            if (!timeout.await(poll)) {
                return containerRuntime.isRunning(containerId);
            }
        }
    }

    static Path stateDir(ShipwrightProperties properties) {
        return Path.of(properties.getProjectRoot()).resolve(properties.getStateDir());
    }

    static Path dataDir(ShipwrightProperties properties) {
        return Path.of(properties.getProjectRoot()).resolve(properties.getValidator().getDataDir());
    }
}
