package com.plantmodel.flowsheet.exception;

/**
 * Base class for all errors raised by the notation, registry, template and conversion layers.
 */
public class FlowsheetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FlowsheetException(String message) {
        super(message);
    }

    public FlowsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
