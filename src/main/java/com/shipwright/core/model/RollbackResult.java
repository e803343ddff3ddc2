package com.shipwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of restoring a snapshot.
 *
 * @param success     whether the snapshot's artifact is running again
 * @param message     human-readable summary
 * @param previousRef container that was replaced ("none" if nothing was running)
 * @param newRef      snapshot version that was restored
 * @param timestamp   when the rollback finished
 * @param details     container ids, image tag, verification flag
 */
public record RollbackResult(
    boolean success,
    String message,
    String previousRef,
    String newRef,
    Instant timestamp,
    Map<String, Object> details
) implements Serializable {

    public RollbackResult {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static RollbackResult failure(String message, String previousRef, String newRef, Instant timestamp) {
        return new RollbackResult(false, message, previousRef, newRef, timestamp, Map.of());
    }

    /**
     * Folds an independent verification into this result: success requires both
     * the rollback and the verification to succeed.
     */
    public RollbackResult withVerification(boolean verified) {
        var merged = new HashMap<String, Object>(details);
        merged.put("verified", verified);
        boolean ok = success && verified;
        String msg = success && !verified
                ? message + " (verification failed: container not running)"
                : message;
        return new RollbackResult(ok, msg, previousRef, newRef, timestamp, merged);
    }
}
