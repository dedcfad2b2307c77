package com.plantmodel.flowsheet.expansion;

import java.util.List;
import java.util.Map;

import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.template.PortDefinition;
import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One instantiated piece of equipment produced by template expansion.
 */
@Value
@Builder
public class EquipmentInstance {
    /** Instance key, e.g. {@code Basin-2} or {@code Blower-1-3}. */
    String id;

    /** Plant tag, e.g. {@code 230-T-02}. */
    String tag;

    String componentClass;
    Equipment equipment;

    /** Null for shared equipment. */
    Integer trainNumber;

    @Singular
    Map<String, ParameterValue> parameters;

    @Singular
    List<PortDefinition> ports;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public boolean isShared() {
        return trainNumber == null;
    }
}
