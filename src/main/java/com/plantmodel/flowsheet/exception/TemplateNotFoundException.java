package com.plantmodel.flowsheet.exception;

import java.util.Collection;
import java.util.List;

/**
 * Raised when an abstract block or process id has no template (or no single mapped type),
 * or when a registered template file is missing.
 */
public class TemplateNotFoundException extends FlowsheetException {

    private static final long serialVersionUID = 1L;
    private final String key;
    private final List<String> knownIds;

    public TemplateNotFoundException(String key, Collection<String> knownIds) {
        this("No template found for '" + key + "'. Available ids: "
                + UnknownComponentTypeException.sorted(knownIds), key, knownIds);
    }

    public TemplateNotFoundException(String message, String key, Collection<String> knownIds) {
        super(message);
        this.key = key;
        this.knownIds = UnknownComponentTypeException.sorted(knownIds);
    }

    public String getKey() {
        return key;
    }

    public List<String> getKnownIds() {
        return knownIds;
    }
}
