package com.shipwright.core.exception;

/**
 * Raised by the container runtime when an operation fails or the daemon
 * cannot be reached at all.
 */
public class ContainerRuntimeException extends ShipwrightException {

    public ContainerRuntimeException(String message) {
        super(message);
    }

    public ContainerRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
