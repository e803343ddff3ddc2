package com.shipwright.runtime;

/**
 * Snapshot of a container as reported by the engine.
 *
 * @param hostPort first published host port, or {@code null} when none is published
 */
public record ContainerInfo(
    String id,
    String name,
    String image,
    boolean running,
    Integer hostPort
) {}
