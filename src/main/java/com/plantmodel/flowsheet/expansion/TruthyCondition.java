package com.plantmodel.flowsheet.expansion;

import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * {@code ${name|default}}: true when the effective value is truthy.
 */
public record TruthyCondition(ParameterOperand operand) implements Condition {

    @Override
    public boolean evaluate(Map<String, ParameterValue> params) {
        return operand.valueIn(params).isTruthy();
    }

    @Override
    public String parameterName() {
        return operand.name();
    }
}
