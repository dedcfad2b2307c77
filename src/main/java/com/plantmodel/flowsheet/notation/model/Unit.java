package com.plantmodel.flowsheet.notation.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Data;

/**
 * A process unit in the intermediate model. Names are unique within one model.
 */
@Data
@Builder(toBuilder = true)
public class Unit {
    private String name;
    private String type;

    @Builder.Default
    private Map<String, ParameterValue> parameters = new LinkedHashMap<>();

    private Integer sequence;

    public boolean hasParameter(String key) {
        return parameters != null && parameters.containsKey(key);
    }

    public ParameterValue getParameter(String key) {
        return parameters == null ? null : parameters.get(key);
    }
}
