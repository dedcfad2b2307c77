package com.plantmodel.flowsheet.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.Nozzle;
import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.RequiredArgsConstructor;

/**
 * Builds equipment objects from component definitions.
 */
@RequiredArgsConstructor
public class ComponentFactory {
    private static final Logger log = LoggerFactory.getLogger(ComponentFactory.class);

    static final String CUSTOM_EQUIPMENT_CLASS = "CustomEquipment";

    /** Parameter overriding the number of generated nozzles. */
    public static final String NOZZLE_COUNT_PARAMETER = "nozzles";

    /** Parameter naming the type of a CustomEquipment. */
    public static final String TYPE_NAME_PARAMETER = "typeName";

    private final ComponentRegistry registry;
    private final ConverterConfig config;

    public ComponentRegistry getRegistry() {
        return registry;
    }

    public Equipment instantiate(String typeKey, String tag, Map<String, ParameterValue> params) {
        return instantiate(registry.resolve(typeKey), tag, params);
    }

    /**
     * Creates the target object: upper-cased tag, default nozzles, recognized optional
     * attributes, then direct overrides.
     */
    public Equipment instantiate(ComponentDefinition definition, String tag, Map<String, ParameterValue> params) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Equipment of type '" + definition.getId() + "' needs a tag");
        }
        Map<String, ParameterValue> parameters = params == null ? Map.of() : params;
        String tagName = tag.trim().toUpperCase(Locale.ROOT);

        Equipment equipment = Equipment.builder()
                .id(tagName)
                .tagName(tagName)
                .componentClass(definition.getTargetClass())
                .build();

        if (CUSTOM_EQUIPMENT_CLASS.equals(definition.getTargetClass())) {
            equipment.setTypeName(definition.getDisplayName() != null ? definition.getDisplayName() : definition.getId());
        }

        int nozzleCount = nozzleCount(definition, parameters);
        for (int i = 0; i < nozzleCount; i++) {
            addNozzle(equipment);
        }

        Map<String, ParameterValue> attributes = new LinkedHashMap<>();
        for (String attribute : definition.getOptionalAttributes()) {
            if (parameters.containsKey(attribute)) {
                attributes.put(attribute, parameters.get(attribute));
            }
        }
        equipment.setAttributes(attributes);

        applyOverrides(equipment, definition, parameters);

        log.debug("Created {} with tag {} and {} nozzles", definition.getTargetClass(), tagName, nozzleCount);
        return equipment;
    }

    /**
     * Instantiates the single type mapped to a unit's abstract block. The unit name
     * becomes the tag.
     */
    public List<Equipment> instantiateFromAbstractBlock(Unit block) {
        ComponentDefinition definition = registry.resolveAbstractBlock(block.getType());
        List<Equipment> result = new ArrayList<>();
        result.add(instantiate(definition, block.getName(), block.getParameters()));
        return result;
    }

    /**
     * Appends a fresh nozzle {@code N<k>} with the default rating.
     */
    public Nozzle addNozzle(Equipment equipment) {
        int index = equipment.getNozzles().size() + 1;
        Nozzle nozzle = Nozzle.builder()
                .id(equipment.getTagName() + "-N" + index)
                .subTagName("N" + index)
                .nominalDiameter(config.getDefaultNominalDiameter())
                .nominalDiameterNumeric(config.getDefaultNominalDiameterNumeric())
                .nominalPressure(config.getDefaultNominalPressure())
                .build();
        equipment.getNozzles().add(nozzle);
        return nozzle;
    }

    private static int nozzleCount(ComponentDefinition definition, Map<String, ParameterValue> parameters) {
        ParameterValue requested = parameters.get(NOZZLE_COUNT_PARAMETER);
        if (requested == null) {
            return definition.getNozzleCountDefault();
        }
        int count = switch (requested.kind()) {
            case NUMBER -> ((ParameterValue.NumberValue) requested).getValue().intValue();
            case STRING -> parseCount(requested.asText(), definition);
            case BOOLEAN, MAP, LIST -> throw new ConfigurationException("Parameter '" + NOZZLE_COUNT_PARAMETER
                    + "' of '" + definition.getId() + "' must be a number, got " + requested.asText());
        };
        if (count < definition.getNozzleCountMin()
                || (definition.getNozzleCountMax() != null && count > definition.getNozzleCountMax())) {
            throw new ConfigurationException("Nozzle count " + count + " for '" + definition.getId()
                    + "' is outside [" + definition.getNozzleCountMin() + ", "
                    + (definition.getNozzleCountMax() == null ? "unbounded" : definition.getNozzleCountMax()) + "]");
        }
        return count;
    }

    private static int parseCount(String text, ComponentDefinition definition) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Parameter '" + NOZZLE_COUNT_PARAMETER + "' of '"
                    + definition.getId() + "' must be a number, got '" + text + "'", e);
        }
    }

    private static void applyOverrides(Equipment equipment, ComponentDefinition definition,
                                       Map<String, ParameterValue> parameters) {
        parameters.forEach((key, value) -> {
            if (TYPE_NAME_PARAMETER.equals(key)) {
                equipment.setTypeName(value.asText());
            } else if (!equipment.getAttributes().containsKey(key) && !NOZZLE_COUNT_PARAMETER.equals(key)) {
                log.debug("Parameter '{}' is not an attribute of {} and is ignored", key, definition.getTargetClass());
            }
        });
    }
}
