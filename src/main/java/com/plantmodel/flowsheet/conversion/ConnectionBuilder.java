package com.plantmodel.flowsheet.conversion;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.plant.CustomStringAttribute;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.Nozzle;
import com.plantmodel.flowsheet.plant.Pipe;
import com.plantmodel.flowsheet.plant.PipingNetworkSegment;
import com.plantmodel.flowsheet.plant.PipingNetworkSystem;
import com.plantmodel.flowsheet.plant.PipingToolkit;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.registry.ComponentFactory;

/**
 * Connects two pieces of equipment with a piping segment.
 *
 * The source side reuses its last free nozzle and the target side its first free one;
 * a nozzle is added when none is free. The segment id embeds both tags
 * ({@code segment__FROM__TO}) so the connection can be read back even when the item
 * references are missing.
 */
public class ConnectionBuilder {
    private static final Logger log = LoggerFactory.getLogger(ConnectionBuilder.class);

    /** Prefix of segment attributes carrying stream tags, e.g. {@code tag:he}. */
    public static final String TAG_ATTRIBUTE_PREFIX = "tag:";

    private final ComponentFactory factory;
    private final ConverterConfig config;
    private final PipingToolkit toolkit;

    public ConnectionBuilder(ComponentFactory factory, ConverterConfig config, PipingToolkit toolkit) {
        this.factory = factory;
        this.config = config;
        this.toolkit = toolkit;
    }

    public PipingNetworkSegment connect(PlantModel model, Equipment from, Equipment to,
                                        String streamKind, Map<String, List<String>> tags,
                                        ConversionDiagnostics diagnostics) {
        Nozzle sourceNozzle = freeNozzleFromEnd(from);
        Nozzle targetNozzle = freeNozzleFromStart(to);
        if (targetNozzle == sourceNozzle) {
            targetNozzle = factory.addNozzle(to);
        }

        PipingNetworkSystem system = model.getConceptualModel().pipingSystem(config.getPipingSystemId());
        String segmentId = uniqueSegmentId(model, PipingNetworkSegment.idFor(from.getTagName(), to.getTagName()));

        PipingNetworkSegment segment = PipingNetworkSegment.builder()
                .id(segmentId)
                .pipingClass(config.getDefaultPipingClass())
                .build();
        segment.getPipes().add(Pipe.builder()
                .id(segmentId + "_pipe")
                .tagName(from.getTagName() + "_to_" + to.getTagName())
                .streamKind(streamKind)
                .build());
        if (tags != null) {
            tags.forEach((kind, values) -> {
                if (!values.isEmpty()) {
                    segment.getCustomAttributes().add(
                            new CustomStringAttribute(TAG_ATTRIBUTE_PREFIX + kind, String.join(",", values)));
                }
            });
        }

        try {
            toolkit.connect(segment, from, sourceNozzle, to, targetNozzle);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Could not link segment {}: {}. The segment id still records the connection",
                    segmentId, e.getMessage());
            diagnostics.warn("Segment " + segmentId + " is not linked: " + e.getMessage());
        }

        system.getSegments().add(segment);
        log.debug("Connected {}:{} -> {}:{} as {}", from.getTagName(), sourceNozzle.getSubTagName(),
                to.getTagName(), targetNozzle.getSubTagName(), segmentId);
        return segment;
    }

    private Nozzle freeNozzleFromEnd(Equipment equipment) {
        List<Nozzle> nozzles = equipment.getNozzles();
        for (int i = nozzles.size() - 1; i >= 0; i--) {
            if (!nozzles.get(i).isConnected()) {
                return nozzles.get(i);
            }
        }
        return factory.addNozzle(equipment);
    }

    private Nozzle freeNozzleFromStart(Equipment equipment) {
        return equipment.getNozzles().stream()
                .filter(n -> !n.isConnected())
                .findFirst()
                .orElseGet(() -> factory.addNozzle(equipment));
    }

    /** Parallel streams between the same pair get {@code __2}, {@code __3}, ... appended. */
    private static String uniqueSegmentId(PlantModel model, String base) {
        Set<String> existing = model.getConceptualModel().allSegments().stream()
                .map(PipingNetworkSegment::getId)
                .collect(Collectors.toSet());
        if (!existing.contains(base)) {
            return base;
        }
        int n = 2;
        while (existing.contains(base + PipingNetworkSegment.ID_SEPARATOR + n)) {
            n++;
        }
        return base + PipingNetworkSegment.ID_SEPARATOR + n;
    }
}
