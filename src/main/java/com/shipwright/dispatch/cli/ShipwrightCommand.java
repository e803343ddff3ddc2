package com.shipwright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Shipwright.
 * Routes to subcommands: deploy, quick-deploy, rollback, snapshots.
 */
@Command(
        name = "shipwright",
        mixinStandardHelpOptions = true,
        version = "Shipwright 0.1.0",
        description = "Gated release pipeline with automatic rollback",
        subcommands = {
                DeployCommand.class,
                QuickDeployCommand.class,
                RollbackCommand.class,
                SnapshotsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShipwrightCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
