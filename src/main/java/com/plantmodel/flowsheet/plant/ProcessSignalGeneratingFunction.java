package com.plantmodel.flowsheet.plant;

import lombok.Builder;
import lombok.Data;

/**
 * Sensor part of an instrumentation function. {@code sensingLocation} holds the id of
 * the measured equipment, or null when the controller is not attached to any.
 */
@Data
@Builder
public class ProcessSignalGeneratingFunction {
    private String id;
    private String tagName;
    private String sensorType;
    private String sensingLocation;
}
