package com.shipwright.core.exception;

/**
 * Base type for faults that abort a command outright, as opposed to failed
 * checks, which are reported as values.
 */
public class ShipwrightException extends RuntimeException {

    public ShipwrightException(String message) {
        super(message);
    }

    public ShipwrightException(String message, Throwable cause) {
        super(message, cause);
    }
}
