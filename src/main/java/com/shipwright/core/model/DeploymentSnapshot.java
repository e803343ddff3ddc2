package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted record of what was running in an environment before a deployment,
 * sufficient to recreate it during rollback.
 * <p>
 * A blank {@code artifactTag} means nothing was running; rolling back to such a
 * snapshot leaves the environment empty.
 */
public record DeploymentSnapshot(
    String versionId,
    Instant timestamp,
    String environment,
    String artifactTag,
    String containerId,
    String containerName,
    int port,
    int containerPort,
    String dataBackupPath
) implements Serializable {

    public boolean hasArtifact() {
        return artifactTag != null && !artifactTag.isBlank();
    }

    public boolean hasDataBackup() {
        return dataBackupPath != null && !dataBackupPath.isBlank();
    }
}
