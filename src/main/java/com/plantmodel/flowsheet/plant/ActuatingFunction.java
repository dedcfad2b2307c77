package com.plantmodel.flowsheet.plant;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ActuatingFunction {
    private String id;
    private String tagName;
}
