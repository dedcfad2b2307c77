package com.plantmodel.flowsheet.expansion;

import java.util.Map;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * A parameter reference with an optional written default, as in {@code ${flag|false}}.
 */
public record ParameterOperand(String name, String defaultValue) {

    public ParameterValue valueIn(Map<String, ParameterValue> params) {
        ParameterValue value = params.get(name);
        if (value != null) {
            return value;
        }
        if (defaultValue == null) {
            throw new ConfigurationException("Condition parameter '" + name
                    + "' has no value and no default");
        }
        return ParameterValue.coerce(defaultValue);
    }
}
