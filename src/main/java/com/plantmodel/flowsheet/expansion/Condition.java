package com.plantmodel.flowsheet.expansion;

import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Inclusion condition of an equipment spec. Only two shapes exist: a truthy check of one
 * parameter and an equality comparison of one parameter with a literal.
 */
public interface Condition {

    boolean evaluate(Map<String, ParameterValue> params);

    /** Parameter the condition reads. */
    String parameterName();
}
