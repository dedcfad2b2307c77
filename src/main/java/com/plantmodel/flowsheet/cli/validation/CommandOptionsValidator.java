package com.plantmodel.flowsheet.cli.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.plantmodel.flowsheet.cli.exception.OptionsValidationException;
import com.plantmodel.flowsheet.cli.model.ConvertOptions;
import com.plantmodel.flowsheet.cli.model.ExpandOptions;
import com.plantmodel.flowsheet.cli.model.RoundTripOptions;
import com.plantmodel.flowsheet.cli.model.ValidatedConvertOptions;
import com.plantmodel.flowsheet.cli.model.ValidatedExpandOptions;
import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.notation.NotationVersion;
import com.plantmodel.flowsheet.value.ParameterValue;

public class CommandOptionsValidator {

    public ValidatedConvertOptions validate(ConvertOptions o) {
        List<String> errors = new ArrayList<>();

        String text = notationText(o.getInput(), o.getNotation(), errors);
        NotationVersion version = null;
        try {
            version = NotationVersion.fromString(o.getNotationVersion());
        } catch (ConfigurationException e) {
            errors.add(e.getMessage());
        }
        checkTemplatesDir(o.getTemplatesDir(), errors);
        if (o.getOutput() != null && Files.isDirectory(o.getOutput())) {
            errors.add("Output path is a directory: " + o.getOutput());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new ValidatedConvertOptions(text, version);
    }

    public ValidatedConvertOptions validate(RoundTripOptions o) {
        List<String> errors = new ArrayList<>();
        String text = notationText(o.getInput(), o.getNotation(), errors);
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new ValidatedConvertOptions(text, NotationVersion.V2);
    }

    public ValidatedExpandOptions validate(ExpandOptions o) {
        List<String> errors = new ArrayList<>();

        if (isBlank(o.getProcessId())) {
            errors.add("Process template id is required (--process / -p).");
        }
        if (o.getTrainCount() < 1) {
            errors.add("Train count must be at least 1 (--trains), got " + o.getTrainCount() + ".");
        }
        if (o.getAreaNumber() != null && o.getAreaNumber() < 0) {
            errors.add("Area number must not be negative (--area), got " + o.getAreaNumber() + ".");
        }
        checkTemplatesDir(o.getTemplatesDir(), errors);
        if (o.getReport() != null && Files.isDirectory(o.getReport())) {
            errors.add("Report path is a directory: " + o.getReport());
        }

        Map<String, ParameterValue> parameters = new LinkedHashMap<>();
        o.getParameters().forEach((name, value) -> {
            if (isBlank(name)) {
                errors.add("Template parameter without a name: '=" + value + "'.");
            } else {
                parameters.put(name.trim(), ParameterValue.coerce(value));
            }
        });

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        String blockId = isBlank(o.getBlockId()) ? o.getProcessId() : o.getBlockId();
        return new ValidatedExpandOptions(blockId, parameters);
    }

    private static String notationText(Path input, String inline, List<String> errors) {
        if (input == null && isBlank(inline)) {
            errors.add("Either --input or --notation must be provided.");
            return null;
        }
        if (input != null && !isBlank(inline)) {
            errors.add("Use either --input or --notation, not both.");
            return null;
        }
        if (input == null) {
            return inline;
        }
        if (!Files.isRegularFile(input)) {
            errors.add("Input file does not exist: " + input);
            return null;
        }
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            errors.add("Input file cannot be read: " + input + " (" + e.getMessage() + ")");
            return null;
        }
    }

    private static void checkTemplatesDir(Path dir, List<String> errors) {
        if (dir != null && !Files.isDirectory(dir)) {
            errors.add("Templates directory does not exist or is not a directory: " + dir);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
