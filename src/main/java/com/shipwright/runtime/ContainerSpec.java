package com.shipwright.runtime;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything needed to start one service container.
 *
 * @param dataDir        host directory bind-mounted into the container, or {@code null} for none
 * @param dataMountPath  mount point of {@code dataDir} inside the container
 */
public record ContainerSpec(
    String name,
    String image,
    int hostPort,
    int containerPort,
    Map<String, String> env,
    Path dataDir,
    String dataMountPath
) {

    public ContainerSpec {
        env = env != null ? Map.copyOf(env) : Map.of();
    }
}
