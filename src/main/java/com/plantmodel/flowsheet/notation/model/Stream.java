package com.plantmodel.flowsheet.notation.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Data;

/**
 * A directed stream between two units. Endpoints are plain names and are only checked
 * against the unit set when the model is converted.
 */
@Data
@Builder(toBuilder = true)
public class Stream {
    private String fromUnit;
    private String toUnit;
    private String name;

    @Builder.Default
    private Map<String, ParameterValue> properties = new LinkedHashMap<>();

    /** Tag kind to tag values, e.g. {@code he -> [HE101]}. */
    @Builder.Default
    private Map<String, List<String>> tags = new LinkedHashMap<>();

    public void addTag(String kind, String value) {
        tags.computeIfAbsent(kind, k -> new ArrayList<>()).add(value);
    }

    public boolean hasTags() {
        return tags != null && !tags.isEmpty();
    }
}
