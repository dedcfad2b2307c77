package com.plantmodel.flowsheet.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "round-trip" command.
 */
@Getter
public class RoundTripOptions {

    @Option(names = { "--input", "-i" }, description = "File holding the notation text")
    private Path input;

    @Option(names = { "--notation", "-n" }, description = "Notation text given inline")
    private String notation;

    @Option(names = { "--verbose", "-v" }, description = "Log every conversion decision")
    private boolean verbose;
}
