package com.plantmodel.flowsheet.plant;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Data;

/**
 * A control loop such as {@code FC-101}: category {@code F}, modifier {@code C},
 * number {@code 101}.
 */
@Data
@Builder
public class ProcessInstrumentationFunction {
    private String id;
    private String tagName;
    private String category;
    private String modifier;
    private String number;

    @Builder.Default
    private List<ProcessSignalGeneratingFunction> signalGeneratingFunctions = new ArrayList<>();

    @Builder.Default
    private List<ActuatingFunction> actuatingFunctions = new ArrayList<>();

    @Builder.Default
    private List<CustomStringAttribute> customAttributes = new ArrayList<>();

    public Optional<String> customAttribute(String name) {
        return customAttributes.stream()
                .filter(a -> a.getAttributeName().equals(name))
                .map(CustomStringAttribute::getValue)
                .findFirst();
    }
}
