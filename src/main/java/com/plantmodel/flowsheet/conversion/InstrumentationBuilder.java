package com.plantmodel.flowsheet.conversion;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.plant.ActuatingFunction;
import com.plantmodel.flowsheet.plant.CustomStringAttribute;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;
import com.plantmodel.flowsheet.plant.ProcessSignalGeneratingFunction;

/**
 * Builds the instrumentation function for one controller unit.
 */
public class InstrumentationBuilder {
    private static final Logger log = LoggerFactory.getLogger(InstrumentationBuilder.class);

    static final String SENSOR_SUFFIX = "_sensor";
    static final String VALVE_SUFFIX = "_valve";

    private static final Pattern TAG = Pattern.compile("([A-Za-z]+)-?(\\d*).*");

    private final ControlUnitClassifier classifier;

    public InstrumentationBuilder(ControlUnitClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param controllerTag  unit name, upper-cased into the function tag
     * @param controllerKind e.g. {@code LC}; stored as the {@code ControlType} attribute
     * @param sensed         measured equipment, or null when the controller has no input
     */
    public ProcessInstrumentationFunction build(String controllerTag, String controllerKind, Equipment sensed) {
        String tag = controllerTag.toUpperCase(Locale.ROOT);
        String variable = classifier.measuredVariable(controllerKind);

        ProcessInstrumentationFunction function = ProcessInstrumentationFunction.builder()
                .id(tag)
                .tagName(tag)
                .build();
        splitTag(tag, controllerKind, function);

        function.getSignalGeneratingFunctions().add(ProcessSignalGeneratingFunction.builder()
                .id(tag + SENSOR_SUFFIX)
                .tagName(tag + SENSOR_SUFFIX)
                .sensorType(variable)
                .sensingLocation(sensed != null ? sensed.getId() : null)
                .build());
        function.getActuatingFunctions().add(ActuatingFunction.builder()
                .id(tag + VALVE_SUFFIX)
                .tagName(tag + VALVE_SUFFIX)
                .build());
        function.getCustomAttributes().add(new CustomStringAttribute(
                ControlUnitClassifier.CONTROL_TYPE_ATTRIBUTE, controllerKind));

        log.debug("Controller {} ({}) measures {} at {}", tag, controllerKind, variable,
                sensed != null ? sensed.getTagName() : "nothing");
        return function;
    }

    /**
     * {@code FIC-101} becomes category {@code F}, modifier {@code IC}, number {@code 101}.
     * Single-letter tags such as {@code C-3} take their letters from the controller kind.
     */
    private static void splitTag(String tag, String controllerKind, ProcessInstrumentationFunction function) {
        Matcher m = TAG.matcher(tag);
        String letters = m.matches() ? m.group(1) : "";
        String number = m.matches() ? m.group(2) : "";
        if (letters.length() < 2) {
            letters = controllerKind;
        }
        function.setCategory(letters.substring(0, 1));
        function.setModifier(letters.substring(1));
        function.setNumber(number.isEmpty() ? null : number);
    }
}
