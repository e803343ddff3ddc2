package com.shipwright.core.engine;

import com.shipwright.core.model.DeploymentAttempt;
import com.shipwright.core.model.EnvironmentProfile;

import java.nio.file.Path;
import java.time.Clock;

/**
 * State threaded through the stages of one attempt. Nothing here outlives the attempt.
 */
public record AttemptContext(
    DeploymentAttempt attempt,
    EnvironmentProfile profile,
    Path projectRoot,
    CancellationToken cancellation,
    Clock clock
) {

    public String attemptId() {
        return attempt.attemptId();
    }

    public String environment() {
        return profile.name();
    }
}
