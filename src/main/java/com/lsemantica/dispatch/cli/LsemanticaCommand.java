package com.lsemantica.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for L-Semantica governance.
 * Routes to the contract, repair, gate, runtime, pipeline and reliability subcommands.
 */
@Command(
        name = "lsemantica",
        mixinStandardHelpOptions = true,
        version = "L-Semantica governance 0.1.0",
        description = "Reliability and continuation governance for intent-to-patch pipelines",
        subcommands = {
                ValidateCommand.class,
                RepairCommand.class,
                GateCommand.class,
                RunCommand.class,
                SnapshotCommand.class,
                MapIntentCommand.class,
                PlanDiffCommand.class,
                PatchRunCommand.class,
                PrBundleCommand.class,
                PipelineCommand.class,
                ReliabilityGatesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LsemanticaCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
