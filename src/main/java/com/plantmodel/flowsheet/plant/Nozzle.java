package com.plantmodel.flowsheet.plant;

import lombok.Builder;
import lombok.Data;

/**
 * Connection point on a piece of equipment.
 */
@Data
@Builder
public class Nozzle {
    private String id;
    private String subTagName;
    private String nominalDiameter;
    private String nominalDiameterNumeric;
    private String nominalPressure;
    private boolean connected;
}
