package com.plantmodel.flowsheet.graph;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.PipingNetworkSegment;
import com.plantmodel.flowsheet.plant.PlantModel;

/**
 * Default projector working from segment source/target references. Unlinked segments
 * are left out of the graph.
 */
public class ConnectivityGraphProjector implements PlantGraphProjector {
    private static final Logger log = LoggerFactory.getLogger(ConnectivityGraphProjector.class);

    @Override
    public LabeledGraph project(PlantModel model) {
        LabeledGraph graph = new LabeledGraph();
        Map<String, String> tagById = new HashMap<>();

        for (Equipment equipment : model.getConceptualModel().getEquipment()) {
            tagById.put(equipment.getId(), equipment.getTagName());
            graph.addNode(equipment.getTagName(), Map.of(
                    CLASS_ATTRIBUTE, equipment.getComponentClass(),
                    ID_ATTRIBUTE, equipment.getId()));
        }

        for (PipingNetworkSegment segment : model.getConceptualModel().allSegments()) {
            if (!segment.isLinked()) {
                log.debug("Segment {} has no item references", segment.getId());
                continue;
            }
            String from = tagById.get(segment.getSourceItem());
            String to = tagById.get(segment.getTargetItem());
            if (from == null || to == null) {
                throw new IllegalStateException("Segment " + segment.getId() + " references unknown equipment "
                        + (from == null ? segment.getSourceItem() : segment.getTargetItem()));
            }
            graph.addEdge(from, to, Map.of(SEGMENT_ATTRIBUTE, segment.getId()));
        }
        return graph;
    }
}
