package com.plantmodel.flowsheet.template;

import lombok.Builder;
import lombok.Value;

/**
 * Named port on a template equipment spec.
 */
@Value
@Builder(toBuilder = true)
public class PortDefinition {
    String name;
    String direction;

    @Builder.Default
    String type = "Standard";

    String nominalDiameter;
}
