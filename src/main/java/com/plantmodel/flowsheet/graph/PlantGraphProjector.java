package com.plantmodel.flowsheet.graph;

import com.plantmodel.flowsheet.plant.PlantModel;

/**
 * Projects a plant model onto a connectivity graph.
 */
public interface PlantGraphProjector {

    String CLASS_ATTRIBUTE = "componentClass";
    String ID_ATTRIBUTE = "id";
    String SEGMENT_ATTRIBUTE = "segment";

    /**
     * Equipment become nodes keyed by tag; linked piping segments become edges carrying
     * the segment id.
     *
     * @throws IllegalStateException when a segment references equipment absent from the model
     */
    LabeledGraph project(PlantModel model);
}
