package com.plantmodel.flowsheet.plant;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Data;

/**
 * A piece of process equipment. {@code componentClass} names the target class, e.g.
 * {@code CentrifugalPump}.
 */
@Data
@Builder
public class Equipment {
    private String id;
    private String tagName;
    private String componentClass;

    /** Set for CustomEquipment only. */
    private String typeName;

    @Builder.Default
    private List<Nozzle> nozzles = new ArrayList<>();

    @Builder.Default
    private Map<String, ParameterValue> attributes = new LinkedHashMap<>();

    @Builder.Default
    private List<CustomStringAttribute> customAttributes = new ArrayList<>();

    public Optional<Nozzle> findNozzle(String nozzleId) {
        return nozzles.stream().filter(n -> n.getId().equals(nozzleId)).findFirst();
    }

    public Optional<String> customAttribute(String name) {
        return customAttributes.stream()
                .filter(a -> a.getAttributeName().equals(name))
                .map(CustomStringAttribute::getValue)
                .findFirst();
    }
}
