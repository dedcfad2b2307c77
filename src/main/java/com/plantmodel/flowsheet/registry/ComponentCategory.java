package com.plantmodel.flowsheet.registry;

import java.util.Arrays;
import java.util.Locale;

import com.plantmodel.flowsheet.exception.ConfigurationException;

/**
 * Coarse grouping of component definitions.
 */
public enum ComponentCategory {
    ROTATING,
    STATIC,
    HEAT_TRANSFER,
    SEPARATION,
    REACTION,
    STORAGE,
    TRANSPORT,
    TREATMENT,
    VALVE,
    INSTRUMENTATION,
    CUSTOM;

    public static ComponentCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(c -> c.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown component category '" + value
                        + "'. Supported: " + Arrays.toString(values())));
    }
}
