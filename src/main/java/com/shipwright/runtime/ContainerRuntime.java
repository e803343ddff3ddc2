package com.shipwright.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction over the container engine that builds and runs the service.
 * Implementations: {@link DockerContainerRuntime}.
 *
 * <p>Every method reports engine faults as
 * {@link com.shipwright.core.exception.ContainerRuntimeException}.
 */
public interface ContainerRuntime {

    /**
     * Checks that the engine is reachable.
     */
    void ping();

    /**
     * Builds an image from the Dockerfile in {@code contextDir}.
     * @return the built image id
     */
    String buildImage(Path contextDir, String tag, Duration timeout);

    /**
     * Looks up a container (running or stopped) by exact name.
     */
    Optional<ContainerInfo> findContainer(String name);

    /**
     * Looks up the running container that publishes the given host port.
     */
    Optional<ContainerInfo> findContainerByPort(int hostPort);

    /**
     * Creates and starts a detached container.
     * @return the container id
     */
    String runContainer(ContainerSpec spec);

    boolean isRunning(String containerId);

    /**
     * Returns the last {@code tail} lines of the container's stdout and stderr.
     */
    String logs(String containerId, int tail);

    /**
     * Stops and removes the container. A container that is already gone is not an error.
     */
    void stopAndRemove(String containerId);
}
