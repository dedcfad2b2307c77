package com.plantmodel.flowsheet.conversion;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;
import com.plantmodel.flowsheet.plant.ProcessSignalGeneratingFunction;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Tells controller units apart from ordinary equipment and maps controller kinds to the
 * variable they measure.
 *
 * A unit is a controller when its type is {@code control}, when it carries a
 * {@code control_type} parameter, or when its name starts with a controller tag prefix
 * such as {@code FC-} or {@code LIC-}.
 */
public class ControlUnitClassifier {

    public static final String CONTROL_TYPE = "control";
    public static final String CONTROL_TYPE_PARAMETER = "control_type";
    public static final String CONTROL_TYPE_ATTRIBUTE = "ControlType";
    public static final String DEFAULT_CONTROLLER_KIND = "FC";
    public static final String DEFAULT_MEASURED_VARIABLE = "Flow";

    static final List<String> CONTROLLER_PREFIXES = List.of(
            "FIC-", "LIC-", "TIC-", "PIC-", "FC-", "LC-", "TC-", "PC-", "C-");

    private static final Map<String, String> MEASURED_VARIABLES = Map.of(
            "FC", "Flow",
            "FIC", "Flow",
            "LC", "Level",
            "LIC", "Level",
            "TC", "Temperature",
            "TIC", "Temperature",
            "PC", "Pressure",
            "PIC", "Pressure");

    private static final Map<String, String> KIND_BY_VARIABLE = Map.of(
            "Flow", "FC",
            "Level", "LC",
            "Temperature", "TC",
            "Pressure", "PC");

    public boolean isControl(Unit unit) {
        if (unit.getType() != null && CONTROL_TYPE.equalsIgnoreCase(unit.getType())) {
            return true;
        }
        if (unit.hasParameter(CONTROL_TYPE_PARAMETER)) {
            return true;
        }
        String name = unit.getName().toUpperCase(Locale.ROOT);
        return CONTROLLER_PREFIXES.stream().anyMatch(name::startsWith);
    }

    /**
     * The explicit {@code control_type}, else the tag letters when they name a known
     * controller, else {@code FC}.
     */
    public String controllerKind(Unit unit) {
        ParameterValue explicit = unit.getParameter(CONTROL_TYPE_PARAMETER);
        if (explicit != null && !explicit.asText().isBlank()) {
            return explicit.asText().trim().toUpperCase(Locale.ROOT);
        }
        String name = unit.getName().toUpperCase(Locale.ROOT);
        int dash = name.indexOf('-');
        String letters = dash > 0 ? name.substring(0, dash) : name;
        return MEASURED_VARIABLES.containsKey(letters) ? letters : DEFAULT_CONTROLLER_KIND;
    }

    public String measuredVariable(String controllerKind) {
        if (controllerKind == null) {
            return DEFAULT_MEASURED_VARIABLE;
        }
        return MEASURED_VARIABLES.getOrDefault(controllerKind.toUpperCase(Locale.ROOT), DEFAULT_MEASURED_VARIABLE);
    }

    /**
     * Recovers the controller kind of an instrumentation function: the stored attribute,
     * then the sensor type, then {@code FC}.
     */
    public String controllerKindOf(ProcessInstrumentationFunction function) {
        var stored = function.customAttribute(CONTROL_TYPE_ATTRIBUTE);
        if (stored.isPresent()) {
            return stored.get();
        }
        for (ProcessSignalGeneratingFunction sensor : function.getSignalGeneratingFunctions()) {
            if (sensor.getSensorType() == null) {
                continue;
            }
            for (Map.Entry<String, String> entry : KIND_BY_VARIABLE.entrySet()) {
                if (sensor.getSensorType().contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return DEFAULT_CONTROLLER_KIND;
    }
}
