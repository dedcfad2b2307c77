package com.plantmodel.flowsheet.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.cli.exception.OptionsValidationException;
import com.plantmodel.flowsheet.cli.model.ExpandOptions;
import com.plantmodel.flowsheet.cli.model.ValidatedExpandOptions;
import com.plantmodel.flowsheet.cli.output.ConversionResultsPrinter;
import com.plantmodel.flowsheet.cli.validation.CommandOptionsValidator;
import com.plantmodel.flowsheet.context.ConverterContext;
import com.plantmodel.flowsheet.expansion.ExpansionReportWriter;
import com.plantmodel.flowsheet.expansion.ExpansionResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Expands a process template into equipment trains.
 */
@Command(
        name = "expand",
        mixinStandardHelpOptions = true,
        description = "Expands a process template into concrete, wired equipment trains."
)
public class ExpandCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExpandCommand.class);

    @Mixin
    private ExpandOptions options;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        try {
            CommandSupport.applyVerbosity(options.isVerbose());
            ValidatedExpandOptions validated = validator.validate(options);

            ConverterContext context = CommandSupport.context(options.getTemplatesDir());
            ExpansionResult result = context.getExpansionEngine().expand(validated.getBlockId(),
                    options.getProcessId(), options.getAreaNumber(), options.getTrainCount(), validated.getParameters());

            if (options.getReport() != null) {
                new ExpansionReportWriter().write(result, options.getReport());
            }
            printer.printExpansion(result);
            return 0;
        } catch (OptionsValidationException e) {
            printer.printErrors(e.getErrors());
            return 1;
        } catch (Exception e) {
            log.error("Expansion failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
