package com.plantmodel.flowsheet.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "convert" command. No validation, no execution logic, no printing.
 */
@Getter
public class ConvertOptions {

    @Option(names = { "--input", "-i" }, description = "File holding the notation text")
    private Path input;

    @Option(names = { "--notation", "-n" }, description = "Notation text given inline")
    private String notation;

    @Option(names = { "--expand", "-x" }, description = "Expand abstract blocks through their templates")
    private boolean expand;

    @Option(names = { "--canonical" }, negatable = true, defaultValue = "true",
            description = "Write the regenerated notation in canonical (sorted) form (default: true)")
    private boolean canonical;

    @Option(names = { "--notation-version" }, defaultValue = "v2",
            description = "Notation version of the regenerated text: v1 or v2 (default: v2)")
    private String notationVersion;

    @Option(names = { "--output", "-o" }, description = "Write the regenerated notation to this file")
    private Path output;

    @Option(names = { "--templates-dir", "-t" }, description = "Directory holding process templates (overrides the classpath set)")
    private Path templatesDir;

    @Option(names = { "--verbose", "-v" }, description = "Log every conversion decision")
    private boolean verbose;
}
