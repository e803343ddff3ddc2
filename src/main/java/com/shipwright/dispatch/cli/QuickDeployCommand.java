package com.shipwright.dispatch.cli;

import com.shipwright.core.engine.DeploymentOrchestrator;
import com.shipwright.core.exception.ShipwrightException;
import com.shipwright.core.metrics.DeploymentMetrics;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: shipwright quick-deploy &lt;environment&gt;
 * <p>
 * Validates without building and smoke tests the service already running.
 */
@Command(name = "quick-deploy", mixinStandardHelpOptions = true,
        description = "Validate and smoke test the running service without redeploying")
@Component
public class QuickDeployCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Target environment (staging, production)")
    private String environment;

    private final DeploymentOrchestrator orchestrator;
    private final DeploymentMetrics metrics;

    public QuickDeployCommand(DeploymentOrchestrator orchestrator, DeploymentMetrics metrics) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Quick check of " + environment);
        try {
            var attempt = orchestrator.quickDeploy(environment);
            ConsoleOutput.attempt(attempt);
            ConsoleOutput.metrics(metrics.summary());
            return attempt.succeeded() ? 0 : 1;
        } catch (ShipwrightException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
