package com.plantmodel.flowsheet.plant;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Pipe {
    private String id;
    private String tagName;
    private String streamKind;
}
