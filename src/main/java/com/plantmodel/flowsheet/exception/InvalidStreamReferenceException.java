package com.plantmodel.flowsheet.exception;

import java.util.Collection;
import java.util.List;

/**
 * Raised when a stream endpoint names a unit that does not exist in the model.
 */
public class InvalidStreamReferenceException extends FlowsheetException {

    private static final long serialVersionUID = 1L;
    private final String unitName;
    private final String role;
    private final List<String> knownUnitNames;

    public InvalidStreamReferenceException(String unitName, String role, Collection<String> knownUnitNames) {
        super("Stream references unknown " + role + " unit '" + unitName + "'. Known units: "
                + UnknownComponentTypeException.sorted(knownUnitNames));
        this.unitName = unitName;
        this.role = role;
        this.knownUnitNames = UnknownComponentTypeException.sorted(knownUnitNames);
    }

    public String getUnitName() {
        return unitName;
    }

    /**
     * Either {@code source} or {@code target}.
     */
    public String getRole() {
        return role;
    }

    public List<String> getKnownUnitNames() {
        return knownUnitNames;
    }
}
