package com.plantmodel.flowsheet.plant;

/**
 * Links a segment to its endpoint nozzles.
 */
public class PipingToolkit {

    /**
     * Sets the segment's source and target references and marks both nozzles connected.
     *
     * @throws IllegalArgumentException when a nozzle does not belong to its equipment
     * @throws IllegalStateException when a nozzle is already connected
     */
    public void connect(PipingNetworkSegment segment,
                        Equipment source, Nozzle sourceNozzle,
                        Equipment target, Nozzle targetNozzle) {
        requireOwned(source, sourceNozzle);
        requireOwned(target, targetNozzle);
        if (sourceNozzle.isConnected() || targetNozzle.isConnected()) {
            throw new IllegalStateException("Nozzle already connected while linking " + segment.getId());
        }
        segment.setSourceItem(source.getId());
        segment.setSourceNode(sourceNozzle.getId());
        segment.setTargetItem(target.getId());
        segment.setTargetNode(targetNozzle.getId());
        sourceNozzle.setConnected(true);
        targetNozzle.setConnected(true);
    }

    private static void requireOwned(Equipment equipment, Nozzle nozzle) {
        if (nozzle == null || equipment.findNozzle(nozzle.getId()).orElse(null) != nozzle) {
            throw new IllegalArgumentException("Nozzle " + (nozzle == null ? "null" : nozzle.getId())
                    + " does not belong to " + equipment.getTagName());
        }
    }
}
