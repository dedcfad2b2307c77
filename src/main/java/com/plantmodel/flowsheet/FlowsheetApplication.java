package com.plantmodel.flowsheet;

import com.plantmodel.flowsheet.cli.FlowsheetCommand;

import picocli.CommandLine;

/**
 * Main entry point of the flowsheet converter.
 */
public class FlowsheetApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowsheetCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
