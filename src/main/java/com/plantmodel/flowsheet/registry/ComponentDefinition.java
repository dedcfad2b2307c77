package com.plantmodel.flowsheet.registry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Canonical record for one component type. Several aliases may point at the same
 * definition; each definition instantiates exactly one target class.
 */
@Value
@Builder(toBuilder = true)
public class ComponentDefinition {
    String id;

    @Singular("alias")
    List<String> aliases;

    String targetClass;
    String abstractBlock;

    @Builder.Default
    ComponentCategory category = ComponentCategory.CUSTOM;

    String displayName;
    String description;
    String symbolId;

    @Builder.Default
    int nozzleCountDefault = 2;

    int nozzleCountMin;
    Integer nozzleCountMax;

    /** Attribute names copied from instantiation parameters when present. */
    @Singular
    List<String> optionalAttributes;

    /** Preferred definition when several share the target class. */
    boolean primary;

    String expansionTemplate;

    @Singular
    Map<String, ParameterValue> expansionParameters;

    public Optional<String> getAbstractBlockId() {
        return Optional.ofNullable(abstractBlock);
    }

    public Optional<String> getExpansionTemplateId() {
        return Optional.ofNullable(expansionTemplate);
    }

    /** All alias keys including the canonical id. */
    public List<String> allAliases() {
        if (aliases.contains(id)) {
            return aliases;
        }
        return Stream.concat(Stream.of(id), aliases.stream()).toList();
    }
}
