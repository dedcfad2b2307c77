package com.plantmodel.flowsheet.template;

import lombok.Builder;
import lombok.Value;

/**
 * One connection line of a template. Endpoints may be patterns such as {@code Basin-*}.
 * Lines touching the block boundary keep the original line in {@code portMapping}.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionSpec {
    String fromEquipment;
    String fromPort;
    String toEquipment;
    String toPort;

    @Builder.Default
    String streamKind = "material";

    @Builder.Default
    boolean perTrain = true;

    String portMapping;
}
