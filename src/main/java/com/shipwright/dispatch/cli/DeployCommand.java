package com.shipwright.dispatch.cli;

import com.shipwright.core.engine.DeployOptions;
import com.shipwright.core.engine.DeploymentOrchestrator;
import com.shipwright.core.exception.ShipwrightException;
import com.shipwright.core.metrics.DeploymentMetrics;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;

/**
 * CLI command: shipwright deploy &lt;environment&gt; [--skip-build] [--deadline PT15M] [--yes]
 * <p>
 * Runs the full gated pipeline and exits 0 only if the attempt succeeded.
 * A production deploy asks for confirmation on stdin unless {@code --yes} is given;
 * declining exits 0 without touching anything.
 */
@Command(name = "deploy", mixinStandardHelpOptions = true,
        description = "Validate, build, deploy, smoke test and monitor a release")
@Component
public class DeployCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Target environment (staging, production)")
    private String environment;

    @Option(names = "--skip-build", description = "Skip the validation build check")
    private boolean skipBuild;

    @Option(names = "--deadline", description = "Overall time budget as ISO-8601 duration, e.g. PT15M")
    private String deadline;

    @Option(names = {"-y", "--yes"}, description = "Skip the production confirmation prompt")
    private boolean assumeYes;

    private static final String PRODUCTION = "production";

    private final DeploymentOrchestrator orchestrator;
    private final DeploymentMetrics metrics;

    public DeployCommand(DeploymentOrchestrator orchestrator, DeploymentMetrics metrics) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Duration budget = null;
        if (deadline != null) {
            try {
                budget = Duration.parse(deadline);
            } catch (DateTimeParseException e) {
                ConsoleOutput.error("Invalid deadline: " + deadline + " (expected ISO-8601, e.g. PT15M)");
                return 1;
            }
        }

        if (PRODUCTION.equals(environment) && !assumeYes && !confirmProduction()) {
            ConsoleOutput.info("Deployment cancelled");
            return 0;
        }

        ConsoleOutput.info("Deploying to " + environment + (skipBuild ? " (validation build skipped)" : ""));
        try {
            var attempt = orchestrator.deploy(environment, new DeployOptions(skipBuild, budget));
            ConsoleOutput.attempt(attempt);
            ConsoleOutput.metrics(metrics.summary());
            return attempt.succeeded() ? 0 : 1;
        } catch (ShipwrightException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private static boolean confirmProduction() {
        ConsoleOutput.warn("This will deploy to PRODUCTION");
        System.out.print("Continue with production deployment? (yes/no): ");
        System.out.flush();
        try {
            // System.in is not ours to close
            var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String answer = reader.readLine();
            return answer != null && answer.trim().equalsIgnoreCase("yes");
        } catch (IOException e) {
            ConsoleOutput.error("Could not read confirmation: " + e.getMessage());
            return false;
        }
    }
}
