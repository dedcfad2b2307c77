package com.plantmodel.flowsheet.exception;

import java.util.Collection;
import java.util.List;

/**
 * Raised when a type key resolves to no registered component definition.
 * The message enumerates every known key.
 */
public class UnknownComponentTypeException extends FlowsheetException {

    private static final long serialVersionUID = 1L;
    private final String key;
    private final List<String> knownKeys;

    public UnknownComponentTypeException(String key, Collection<String> knownKeys) {
        super("Unknown component type: '" + key + "'. Available types: " + sorted(knownKeys));
        this.key = key;
        this.knownKeys = sorted(knownKeys);
    }

    public String getKey() {
        return key;
    }

    public List<String> getKnownKeys() {
        return knownKeys;
    }

    static List<String> sorted(Collection<String> values) {
        return values.stream().distinct().sorted().toList();
    }
}
