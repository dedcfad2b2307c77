package com.plantmodel.flowsheet.template;

import java.util.List;
import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Equipment entry of a process template. String fields and default parameter values may
 * hold {@code ${name}} or {@code ${name|default}} placeholders until expansion.
 */
@Value
@Builder(toBuilder = true)
public class EquipmentSpec {
    /** Local id used in connection lines. */
    String id;

    /** Equipment library reference, without the {@code equipment_library.} prefix. */
    String ref;

    /** Registry type key, e.g. {@code pump}. */
    String component;

    /** Target class name, e.g. {@code CentrifugalBlower}. */
    String componentClass;

    String tagPrefix;

    @Builder.Default
    int count = 1;

    boolean shared;

    String mountTo;

    @Singular
    Map<String, ParameterValue> defaultParams;

    @Singular
    List<PortDefinition> ports;

    String condition;

    /** Key used for instance ids: the local id, else the tag prefix. */
    public String localKey() {
        return id != null && !id.isBlank() ? id : tagPrefix;
    }
}
