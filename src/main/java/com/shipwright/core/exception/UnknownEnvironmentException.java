package com.shipwright.core.exception;

import java.util.Collection;

/**
 * Thrown when a deployment targets an environment with no configured profile.
 */
public class UnknownEnvironmentException extends ShipwrightException {

    public UnknownEnvironmentException(String environment, Collection<String> known) {
        super("Unknown environment '" + environment + "'. Configured environments: " + String.join(", ", known));
    }
}
