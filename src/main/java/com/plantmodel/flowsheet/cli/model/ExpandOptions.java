package com.plantmodel.flowsheet.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options of the "expand" command.
 */
@Getter
public class ExpandOptions {

    @Option(names = { "--process", "-p" }, required = true, description = "Process template id, e.g. TK")
    private String processId;

    @Option(names = { "--block", "-b" }, description = "Name of the block being expanded (defaults to the process id)")
    private String blockId;

    @Option(names = { "--area", "-a" }, description = "Area number used in tags (defaults to the template's area)")
    private Integer areaNumber;

    @Option(names = { "--trains" }, defaultValue = "1", description = "Number of parallel trains (default: 1)")
    private int trainCount;

    @Option(names = { "--param", "-P" }, description = "Template parameter as name=value; repeatable")
    private Map<String, String> parameters = new LinkedHashMap<>();

    @Option(names = { "--report", "-r" }, description = "Write an expansion report to this file")
    private Path report;

    @Option(names = { "--templates-dir", "-t" }, description = "Directory holding process templates (overrides the classpath set)")
    private Path templatesDir;

    @Option(names = { "--verbose", "-v" }, description = "Log every expansion decision")
    private boolean verbose;
}
