package com.shipwright.dispatch.cli;

import com.shipwright.core.exception.ShipwrightException;
import com.shipwright.core.rollback.RollbackAgent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: shipwright snapshots
 */
@Command(name = "snapshots", mixinStandardHelpOptions = true, description = "List saved deployment snapshots")
@Component
public class SnapshotsCommand implements Callable<Integer> {

    private final RollbackAgent rollbackAgent;

    public SnapshotsCommand(RollbackAgent rollbackAgent) {
        this.rollbackAgent = rollbackAgent;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var snapshots = rollbackAgent.listSnapshots();
            if (snapshots.isEmpty()) {
                ConsoleOutput.info("No snapshots saved");
                return 0;
            }
            ConsoleOutput.info(snapshots.size() + " snapshot" + (snapshots.size() != 1 ? "s" : "") + ", newest first");
            snapshots.forEach(ConsoleOutput::snapshot);
            return 0;
        } catch (ShipwrightException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
