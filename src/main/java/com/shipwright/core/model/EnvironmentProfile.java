package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Configuration for one deployment target, resolved once at the start of an
 * attempt and never re-read while the attempt runs.
 *
 * @param name              environment name ("staging", "production")
 * @param port              host port the service is published on
 * @param containerPort     port the service listens on inside the container
 * @param workerCount       worker processes passed to the service
 * @param artifactTag       image tag built and deployed by this attempt
 * @param containerName     container name owned by this environment
 * @param monitorWindow     how long post-deploy health is observed
 * @param monitorInterval   delay between health samples
 * @param rollbackThreshold minimum health rate for the monitor gate
 * @param startupGrace      wait between container start and the first smoke test
 * @param smokeBaseUrl      base URL of the deployed service
 */
public record EnvironmentProfile(
    String name,
    int port,
    int containerPort,
    int workerCount,
    String artifactTag,
    String containerName,
    Duration monitorWindow,
    Duration monitorInterval,
    double rollbackThreshold,
    Duration startupGrace,
    String smokeBaseUrl
) implements Serializable {}
