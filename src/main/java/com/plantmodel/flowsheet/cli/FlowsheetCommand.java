package com.plantmodel.flowsheet.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Spec;

/**
 * Top-level command; the work happens in the subcommands.
 */
@Command(
        name = "flowsheet",
        mixinStandardHelpOptions = true,
        version = "flowsheet-converter 1.0.0",
        description = "Converts between flowsheet notation and structured plant models.",
        subcommands = { ConvertCommand.class, ExpandCommand.class, RoundTripCommand.class }
)
public class FlowsheetCommand implements Callable<Integer> {

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }
}
