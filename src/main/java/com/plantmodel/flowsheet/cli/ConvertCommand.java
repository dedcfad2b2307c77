package com.plantmodel.flowsheet.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.cli.exception.OptionsValidationException;
import com.plantmodel.flowsheet.cli.model.ConvertOptions;
import com.plantmodel.flowsheet.cli.model.ValidatedConvertOptions;
import com.plantmodel.flowsheet.cli.output.ConversionResultsPrinter;
import com.plantmodel.flowsheet.cli.validation.CommandOptionsValidator;
import com.plantmodel.flowsheet.context.ConverterContext;
import com.plantmodel.flowsheet.conversion.ConversionDiagnostics;
import com.plantmodel.flowsheet.conversion.ConversionEngine;
import com.plantmodel.flowsheet.plant.PlantModel;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Converts notation into a plant model and writes the model back as notation.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        description = "Converts flowsheet notation into a plant model and regenerates its notation."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ConversionResultsPrinter printer = new ConversionResultsPrinter();

    @Override
    public Integer call() {
        try {
            CommandSupport.applyVerbosity(options.isVerbose());
            ValidatedConvertOptions validated = validator.validate(options);

            ConverterContext context = CommandSupport.context(options.getTemplatesDir());
            ConversionEngine engine = context.getConversionEngine();
            ConversionDiagnostics diagnostics = new ConversionDiagnostics();

            PlantModel model = engine.toStructuredModel(engine.parse(validated.getNotationText()),
                    options.isExpand(), null, diagnostics);
            String regenerated = engine.notationOf(model, options.isCanonical(), validated.getNotationVersion());

            if (options.getOutput() != null) {
                Files.writeString(options.getOutput(), regenerated + System.lineSeparator(), StandardCharsets.UTF_8);
                log.info("Wrote notation to {}", options.getOutput().toAbsolutePath());
            }
            printer.printConversion(model, regenerated, diagnostics);
            return 0;
        } catch (OptionsValidationException e) {
            printer.printErrors(e.getErrors());
            return 1;
        } catch (Exception e) {
            log.error("Conversion failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
