package com.plantmodel.flowsheet.notation.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Data;

/**
 * Units and streams parsed from notation, or extracted from a plant model.
 */
@Data
@Builder(toBuilder = true)
public class IntermediateModel {

    @Builder.Default
    private List<Unit> units = new ArrayList<>();

    @Builder.Default
    private List<Stream> streams = new ArrayList<>();

    @Builder.Default
    private ModelKind kind = ModelKind.DETAILED;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Optional<Unit> findUnit(String name) {
        return units.stream().filter(u -> u.getName().equals(name)).findFirst();
    }

    public List<String> unitNames() {
        return units.stream().map(Unit::getName).toList();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }
}
