package com.plantmodel.flowsheet.expansion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Flat result of expanding one abstract block.
 */
@Value
@Builder
public class ExpansionResult {
    String flowsheetId;
    String sourceBlock;

    @Singular("equipmentItem")
    List<EquipmentInstance> equipment;

    @Singular
    List<ConnectionInstance> connections;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public Optional<EquipmentInstance> findInstance(String id) {
        return equipment.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    /** Instances by key, in creation order. */
    public Map<String, EquipmentInstance> instancesById() {
        Map<String, EquipmentInstance> byId = new LinkedHashMap<>();
        equipment.forEach(e -> byId.put(e.getId(), e));
        return byId;
    }

    public List<String> tags() {
        return equipment.stream().map(EquipmentInstance::getTag).toList();
    }
}
