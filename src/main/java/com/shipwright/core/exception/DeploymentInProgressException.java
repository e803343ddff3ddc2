package com.shipwright.core.exception;

/**
 * Thrown when a second attempt targets an environment whose lock is already held.
 */
public class DeploymentInProgressException extends ShipwrightException {

    public DeploymentInProgressException(String environment) {
        super("A deployment to '" + environment + "' is already in progress");
    }

    public DeploymentInProgressException(String environment, Throwable cause) {
        super("Could not lock environment '" + environment + "': " + cause.getMessage(), cause);
    }
}
