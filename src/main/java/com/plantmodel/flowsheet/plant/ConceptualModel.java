package com.plantmodel.flowsheet.plant;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Data;

/**
 * Content of a plant model: equipment, piping and instrumentation.
 */
@Data
public class ConceptualModel {
    private final List<Equipment> equipment = new ArrayList<>();
    private final List<PipingNetworkSystem> pipingNetworkSystems = new ArrayList<>();
    private final List<ProcessInstrumentationFunction> instrumentationFunctions = new ArrayList<>();

    public void addEquipment(Equipment item) {
        equipment.add(item);
    }

    public void addInstrumentationFunction(ProcessInstrumentationFunction function) {
        instrumentationFunctions.add(function);
    }

    /**
     * Returns the piping system with the given id, creating it on first use.
     */
    public PipingNetworkSystem pipingSystem(String id) {
        return pipingNetworkSystems.stream()
                .filter(s -> s.getId().equals(id))
                .findFirst()
                .orElseGet(() -> {
                    PipingNetworkSystem system = PipingNetworkSystem.builder().id(id).build();
                    pipingNetworkSystems.add(system);
                    return system;
                });
    }

    public Optional<Equipment> findEquipment(String id) {
        return equipment.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    public List<PipingNetworkSegment> allSegments() {
        return pipingNetworkSystems.stream().flatMap(s -> s.getSegments().stream()).toList();
    }
}
