package com.plantmodel.flowsheet.plant;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PipingNetworkSystem {
    private String id;

    @Builder.Default
    private List<PipingNetworkSegment> segments = new ArrayList<>();
}
