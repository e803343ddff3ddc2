package com.shipwright.dispatch.cli;

import com.shipwright.core.engine.DeploymentOrchestrator;
import com.shipwright.core.exception.ShipwrightException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: shipwright rollback &lt;version_id&gt;
 */
@Command(name = "rollback", mixinStandardHelpOptions = true,
        description = "Restore a saved deployment snapshot")
@Component
public class RollbackCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "VERSION_ID", description = "Snapshot to restore (see 'snapshots')")
    private String versionId;

    private final DeploymentOrchestrator orchestrator;

    public RollbackCommand(DeploymentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Rolling back to " + versionId);
        try {
            var result = orchestrator.rollbackTo(versionId);
            ConsoleOutput.rollback(result);
            return result.success() ? 0 : 1;
        } catch (ShipwrightException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
