package com.plantmodel.flowsheet.template;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A fully composed process template. Instances are immutable and shared through the
 * resolver cache; expansion works on substituted copies.
 */
@Value
@Builder(toBuilder = true)
public class ProcessTemplate {
    String processId;
    Integer areaNumber;
    String name;
    String description;

    @Singular
    Map<String, ParameterSpec> parameters;

    @Singular("perTrainItem")
    List<EquipmentSpec> perTrainEquipment;

    @Singular("sharedItem")
    List<EquipmentSpec> sharedEquipment;

    @Singular
    List<ConnectionSpec> connections;

    @Singular
    Map<String, String> portMappings;

    @Singular("componentUsed")
    List<String> componentsUsed;

    String sourceFile;
}
