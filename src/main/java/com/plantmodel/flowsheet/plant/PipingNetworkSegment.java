package com.plantmodel.flowsheet.plant;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Data;

/**
 * A run of pipe between two equipment nozzles.
 *
 * The id follows {@code segment__FROM__TO} with both equipment tags embedded. The
 * source/target references are filled in by {@link PipingToolkit#connect}.
 */
@Data
@Builder
public class PipingNetworkSegment {
    public static final String ID_PREFIX = "segment__";
    public static final String ID_SEPARATOR = "__";

    private String id;
    private String pipingClass;

    @Builder.Default
    private List<Pipe> pipes = new ArrayList<>();

    private String sourceItem;
    private String sourceNode;
    private String targetItem;
    private String targetNode;

    @Builder.Default
    private List<CustomStringAttribute> customAttributes = new ArrayList<>();

    public static String idFor(String fromTag, String toTag) {
        return ID_PREFIX + fromTag + ID_SEPARATOR + toTag;
    }

    public boolean isLinked() {
        return sourceItem != null && targetItem != null;
    }

    public Optional<String> customAttribute(String name) {
        return customAttributes.stream()
                .filter(a -> a.getAttributeName().equals(name))
                .map(CustomStringAttribute::getValue)
                .findFirst();
    }
}
