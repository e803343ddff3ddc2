package com.shipwright.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import com.shipwright.core.exception.ContainerRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Docker Engine implementation of {@link ContainerRuntime}.
 *
 * <p>Service containers are configured with:
 * <ul>
 *   <li>A single {@code hostPort -> containerPort} TCP binding</li>
 *   <li>A read-write bind mount of the project data directory, when given</li>
 *   <li>Environment variables from the {@link ContainerSpec}</li>
 * </ul>
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private static final long LOG_TIMEOUT_SECONDS = 10;

    private final DockerClient dockerClient;

    public DockerContainerRuntime(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public void ping() {
        call("ping Docker daemon", () -> dockerClient.pingCmd().exec());
    }

    @Override
    public String buildImage(Path contextDir, String tag, Duration timeout) {
        Path dockerfile = contextDir.resolve("Dockerfile");
        if (!Files.isRegularFile(dockerfile)) {
            throw new ContainerRuntimeException("No Dockerfile in " + contextDir);
        }
        log.info("Building image {} from {}", tag, contextDir);
        String imageId = call("build image " + tag, () -> dockerClient.buildImageCmd(contextDir.toFile())
                .withDockerfile(dockerfile.toFile())
                .withTags(Set.of(tag))
                .exec(new BuildImageResultCallback())
                .awaitImageId(timeout.toMillis(), TimeUnit.MILLISECONDS));
        log.info("Built image {} ({})", tag, imageId);
        return imageId;
    }

    @Override
    public Optional<ContainerInfo> findContainer(String name) {
        // The name filter is a substring match; keep exact matches only
        List<Container> containers = call("list containers", () -> dockerClient.listContainersCmd()
                .withShowAll(true)
                .withNameFilter(List.of(name))
                .exec());
        return containers.stream()
                .filter(c -> c.getNames() != null && Arrays.asList(c.getNames()).contains("/" + name))
                .findFirst()
                .map(DockerContainerRuntime::toInfo);
    }

    @Override
    public Optional<ContainerInfo> findContainerByPort(int hostPort) {
        List<Container> containers = call("list containers", () -> dockerClient.listContainersCmd().exec());
        return containers.stream()
                .filter(c -> c.getPorts() != null && Arrays.stream(c.getPorts())
                        .map(ContainerPort::getPublicPort)
                        .anyMatch(p -> p != null && p == hostPort))
                .findFirst()
                .map(DockerContainerRuntime::toInfo);
    }

    @Override
    public String runContainer(ContainerSpec spec) {
        var exposed = ExposedPort.tcp(spec.containerPort());
        var hostConfig = HostConfig.newHostConfig()
                .withPortBindings(new PortBinding(Ports.Binding.bindPort(spec.hostPort()), exposed));
        if (spec.dataDir() != null) {
            hostConfig.withBinds(new Bind(spec.dataDir().toAbsolutePath().toString(),
                    new Volume(spec.dataMountPath()), AccessMode.rw));
        }

        var envList = new ArrayList<String>();
        spec.env().forEach((k, v) -> envList.add(k + "=" + v));

        log.info("Starting container {} from {} on port {}", spec.name(), spec.image(), spec.hostPort());
        String containerId = call("create container " + spec.name(), () -> dockerClient.createContainerCmd(spec.image())
                .withName(spec.name())
                .withExposedPorts(exposed)
                .withHostConfig(hostConfig)
                .withEnv(envList)
                .exec()
                .getId());
        call("start container " + spec.name(), () -> dockerClient.startContainerCmd(containerId).exec());
        log.info("Container {} started ({})", spec.name(), containerId);
        return containerId;
    }

    @Override
    public boolean isRunning(String containerId) {
        try {
            var state = dockerClient.inspectContainerCmd(containerId).exec().getState();
            return state != null && Boolean.TRUE.equals(state.getRunning());
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Failed to inspect container " + containerId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String logs(String containerId, int tail) {
        var sb = new StringBuilder();
        try {
            boolean completed = dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .withTail(tail)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(LOG_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!completed) {
                log.warn("Log capture for container {} timed out after {}s", containerId, LOG_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while reading logs of container {}", containerId);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Failed to read logs of container " + containerId + ": " + e.getMessage(), e);
        }
        return sb.toString();
    }

    @Override
    public void stopAndRemove(String containerId) {
        try {
            dockerClient.stopContainerCmd(containerId).exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} already stopped", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
            return;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Failed to stop container " + containerId + ": " + e.getMessage(), e);
        }
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Container {} removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Failed to remove container " + containerId + ": " + e.getMessage(), e);
        }
    }

    private static ContainerInfo toInfo(Container c) {
        String name = c.getNames() != null && c.getNames().length > 0 ? c.getNames()[0].replaceFirst("^/", "") : "";
        Integer port = c.getPorts() == null ? null : Arrays.stream(c.getPorts())
                .map(ContainerPort::getPublicPort)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        return new ContainerInfo(c.getId(), name, c.getImage(), "running".equalsIgnoreCase(c.getState()), port);
    }

    private static <T> T call(String action, Supplier<T> op) {
        try {
            return op.get();
        } catch (ContainerRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
