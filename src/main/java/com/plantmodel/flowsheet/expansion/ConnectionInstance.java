package com.plantmodel.flowsheet.expansion;

import java.util.Map;

import com.plantmodel.flowsheet.template.ConnectionDslParser;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A resolved connection between two instance keys (or an instance and the block boundary).
 */
@Value
@Builder
public class ConnectionInstance {
    String fromEquipment;
    String fromPort;
    String toEquipment;
    String toPort;
    String streamKind;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public boolean touchesBoundary() {
        return ConnectionDslParser.isBoundary(fromEquipment) || ConnectionDslParser.isBoundary(toEquipment);
    }
}
