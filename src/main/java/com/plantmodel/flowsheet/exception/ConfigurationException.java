package com.plantmodel.flowsheet.exception;

/**
 * Raised for malformed templates or registry data, unsupported condition shapes and
 * template placeholders that cannot be resolved when a template is evaluated.
 */
public class ConfigurationException extends FlowsheetException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
