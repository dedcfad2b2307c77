package com.plantmodel.flowsheet.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.cli.exception.OptionsValidationException;
import com.plantmodel.flowsheet.cli.model.RoundTripOptions;
import com.plantmodel.flowsheet.cli.model.ValidatedConvertOptions;
import com.plantmodel.flowsheet.cli.output.ConversionResultsPrinter;
import com.plantmodel.flowsheet.cli.validation.CommandOptionsValidator;
import com.plantmodel.flowsheet.context.ConverterContext;
import com.plantmodel.flowsheet.conversion.RoundTripReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Checks that notation survives conversion to a plant model and back.
 */
@Command(
        name = "round-trip",
        mixinStandardHelpOptions = true,
        description = "Converts notation to a plant model and back, then reports any difference."
)
public class RoundTripCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RoundTripCommand.class);

    @Mixin
    private RoundTripOptions options;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        try {
            CommandSupport.applyVerbosity(options.isVerbose());
            ValidatedConvertOptions validated = validator.validate(options);

            RoundTripReport report = ConverterContext.defaults().getConversionEngine()
                    .roundTripCheck(validated.getNotationText());
            printer.printRoundTrip(report);
            return report.isValid() ? 0 : 2;
        } catch (OptionsValidationException e) {
            printer.printErrors(e.getErrors());
            return 1;
        } catch (Exception e) {
            log.error("Round trip failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
