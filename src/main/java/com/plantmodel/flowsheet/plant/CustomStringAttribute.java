package com.plantmodel.flowsheet.plant;

import lombok.Value;

/**
 * Free-form named string attached to a plant item.
 */
@Value
public class CustomStringAttribute {
    String attributeName;
    String value;
}
