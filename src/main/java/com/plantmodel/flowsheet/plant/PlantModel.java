package com.plantmodel.flowsheet.plant;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * Root of the structured plant model.
 */
@Data
@Builder
public class PlantModel {

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private ConceptualModel conceptualModel = new ConceptualModel();
}
