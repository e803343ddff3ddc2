package com.shipwright.core.engine;

import java.time.Duration;

/**
 * Per-invocation switches for {@link DeploymentOrchestrator#deploy}.
 *
 * @param skipBuild skip the validator's throwaway build; the release build still runs
 * @param deadline  optional wall-clock budget for the whole attempt
 */
public record DeployOptions(boolean skipBuild, Duration deadline) {

    public static DeployOptions defaults() {
        return new DeployOptions(false, null);
    }
}
