package com.plantmodel.flowsheet.expansion;

import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * {@code ${name|default} == literal} or {@code !=}. Numbers compare numerically.
 */
public record ComparisonCondition(ParameterOperand operand, boolean negated, ParameterValue literal)
        implements Condition {

    @Override
    public boolean evaluate(Map<String, ParameterValue> params) {
        boolean equal = operand.valueIn(params).looselyEquals(literal);
        return negated != equal;
    }

    @Override
    public String parameterName() {
        return operand.name();
    }
}
