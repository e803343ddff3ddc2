package com.shipwright.core.exception;

/**
 * A deployment snapshot could not be written or read back.
 */
public class SnapshotPersistenceException extends ShipwrightException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
