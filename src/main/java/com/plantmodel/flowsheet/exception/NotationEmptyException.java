package com.plantmodel.flowsheet.exception;

/**
 * Raised when notation text matches neither grammar or yields an empty model.
 */
public class NotationEmptyException extends FlowsheetException {

    private static final long serialVersionUID = 1L;
    private final String input;

    public NotationEmptyException(String input) {
        super("Notation parsing produced an empty model (no units found) for input: '" + input + "'");
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
