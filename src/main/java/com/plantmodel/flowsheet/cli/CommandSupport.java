package com.plantmodel.flowsheet.cli;

import java.nio.file.Path;

import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.context.ConverterContext;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Helpers shared by the subcommands.
 */
final class CommandSupport {

    static final String BASE_LOGGER = "com.plantmodel.flowsheet";

    private CommandSupport() {
        // Utility class
    }

    static ConverterContext context(Path templatesDir) {
        ConverterConfig config = ConverterConfig.fromEnvironment();
        if (templatesDir != null) {
            config = config.toBuilder().templatesDir(templatesDir).build();
        }
        return ConverterContext.create(config);
    }

    static void applyVerbosity(boolean verbose) {
        if (verbose && LoggerFactory.getLogger(BASE_LOGGER) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
