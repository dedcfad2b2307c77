package com.plantmodel.flowsheet.conversion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.graph.LabeledGraph;
import com.plantmodel.flowsheet.graph.PlantGraphProjector;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.ModelKind;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.CustomStringAttribute;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.PipingNetworkSegment;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;
import com.plantmodel.flowsheet.plant.ProcessSignalGeneratingFunction;
import com.plantmodel.flowsheet.registry.ComponentDefinition;
import com.plantmodel.flowsheet.registry.ComponentFactory;
import com.plantmodel.flowsheet.registry.ComponentRegistry;
import com.plantmodel.flowsheet.util.NamingUtil;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Reads a plant model back into units and streams.
 *
 * Equipment becomes units named by their lower-cased tag. Connections come from the graph
 * projection; segments it does not cover are read from their {@code segment__FROM__TO} id
 * and, failing that, from their item references. Instrumentation functions become
 * {@code control} units fed by a signal stream from the equipment they sense.
 */
public class PlantModelExtractor {
    private static final Logger log = LoggerFactory.getLogger(PlantModelExtractor.class);

    public static final String SIGNAL_TAG_KIND = "signal";
    public static final String SIGNAL_TAG_VALUE = "not_next_unitop";

    private final ComponentRegistry registry;
    private final PlantGraphProjector projector;
    private final ControlUnitClassifier classifier;

    public PlantModelExtractor(ComponentRegistry registry, PlantGraphProjector projector,
                               ControlUnitClassifier classifier) {
        this.registry = registry;
        this.projector = projector;
        this.classifier = classifier;
    }

    public IntermediateModel extract(PlantModel model, ConversionDiagnostics diagnostics) {
        List<Unit> units = new ArrayList<>();
        Map<String, String> unitByTag = new HashMap<>();
        Map<String, String> unitById = new HashMap<>();

        for (Equipment equipment : model.getConceptualModel().getEquipment()) {
            String name = unitName(equipment.getTagName());
            unitByTag.put(equipment.getTagName(), name);
            unitById.put(equipment.getId(), name);
            units.add(toUnit(equipment, name));
        }

        List<Stream> streams = new ArrayList<>();
        Set<String> covered = projectedStreams(model, unitByTag, streams, diagnostics);
        Map<String, PipingNetworkSegment> segmentsById = new HashMap<>();
        model.getConceptualModel().allSegments().forEach(s -> segmentsById.put(s.getId(), s));

        for (PipingNetworkSegment segment : model.getConceptualModel().allSegments()) {
            if (covered.contains(segment.getId())) {
                continue;
            }
            Optional<String[]> endpoints = endpointsFromId(segment.getId(), unitByTag);
            if (endpoints.isEmpty() && segment.isLinked()
                    && unitById.containsKey(segment.getSourceItem()) && unitById.containsKey(segment.getTargetItem())) {
                endpoints = Optional.of(new String[] {
                        unitById.get(segment.getSourceItem()), unitById.get(segment.getTargetItem())});
            }
            if (endpoints.isEmpty()) {
                log.warn("Segment {} names no known equipment and is skipped", segment.getId());
                diagnostics.warn("Segment " + segment.getId() + " could not be read back");
                continue;
            }
            streams.add(toStream(endpoints.get()[0], endpoints.get()[1], segment, streams.size()));
        }

        // projected streams carry no tags yet
        for (Stream stream : streams) {
            Object segmentId = stream.getProperties().get(PlantGraphProjector.SEGMENT_ATTRIBUTE);
            if (segmentId instanceof ParameterValue id && segmentsById.containsKey(id.asText())) {
                copyTags(segmentsById.get(id.asText()), stream);
            }
            stream.getProperties().remove(PlantGraphProjector.SEGMENT_ATTRIBUTE);
        }

        for (ProcessInstrumentationFunction function : model.getConceptualModel().getInstrumentationFunctions()) {
            String name = unitName(function.getTagName());
            String kind = classifier.controllerKindOf(function);
            Map<String, ParameterValue> parameters = new LinkedHashMap<>();
            parameters.put(ControlUnitClassifier.CONTROL_TYPE_PARAMETER, ParameterValue.ofString(kind));
            units.add(Unit.builder()
                    .name(name)
                    .type(ControlUnitClassifier.CONTROL_TYPE)
                    .parameters(parameters)
                    .sequence(NamingUtil.indexOf(name))
                    .build());

            sensedUnit(function, unitById).ifPresent(sensed -> {
                Stream signal = Stream.builder()
                        .fromUnit(sensed)
                        .toUnit(name)
                        .name("s" + (streams.size() + 1))
                        .build();
                signal.addTag(SIGNAL_TAG_KIND, SIGNAL_TAG_VALUE);
                streams.add(signal);
            });
        }

        Map<String, Object> metadata = new LinkedHashMap<>(model.getMetadata());
        log.info("Extracted {} units and {} streams from plant model", units.size(), streams.size());
        return IntermediateModel.builder()
                .units(units)
                .streams(streams)
                .kind(ModelKind.DETAILED)
                .metadata(metadata)
                .build();
    }

    /**
     * Streams from the graph projection. A projection failure is not fatal: every segment
     * is then read from its id.
     */
    private Set<String> projectedStreams(PlantModel model, Map<String, String> unitByTag,
                                         List<Stream> streams, ConversionDiagnostics diagnostics) {
        Set<String> covered = new HashSet<>();
        LabeledGraph graph;
        try {
            graph = projector.project(model);
        } catch (RuntimeException e) {
            log.warn("Graph projection failed, reading connections from segment ids: {}", e.getMessage());
            diagnostics.warn("Graph projection failed: " + e.getMessage());
            return covered;
        }
        for (LabeledGraph.Edge edge : graph.edges()) {
            String from = unitByTag.get(edge.from());
            String to = unitByTag.get(edge.to());
            if (from == null || to == null) {
                continue;
            }
            Stream stream = Stream.builder()
                    .fromUnit(from)
                    .toUnit(to)
                    .name("s" + (streams.size() + 1))
                    .build();
            Object segmentId = edge.attributes().get(PlantGraphProjector.SEGMENT_ATTRIBUTE);
            if (segmentId != null) {
                covered.add(segmentId.toString());
                stream.getProperties().put(PlantGraphProjector.SEGMENT_ATTRIBUTE,
                        ParameterValue.ofString(segmentId.toString()));
            }
            streams.add(stream);
        }
        return covered;
    }

    /** Splits {@code segment__FROM__TO[__n]} into unit names when both tags are known. */
    static Optional<String[]> endpointsFromId(String segmentId, Map<String, String> unitByTag) {
        if (segmentId == null || !segmentId.startsWith(PipingNetworkSegment.ID_PREFIX)) {
            return Optional.empty();
        }
        String[] parts = segmentId.substring(PipingNetworkSegment.ID_PREFIX.length())
                .split(PipingNetworkSegment.ID_SEPARATOR, -1);
        if (parts.length < 2) {
            return Optional.empty();
        }
        String from = unitByTag.get(parts[0]);
        String to = unitByTag.get(parts[1]);
        if (from == null || to == null) {
            log.debug("Segment id {} does not name known equipment: {}", segmentId, Arrays.toString(parts));
            return Optional.empty();
        }
        return Optional.of(new String[] {from, to});
    }

    private Unit toUnit(Equipment equipment, String name) {
        Optional<ComponentDefinition> definition = registry.findByTargetClass(equipment.getComponentClass());
        String type = definition.map(ComponentDefinition::getId)
                .orElseGet(() -> NamingUtil.toSnakeCase(equipment.getComponentClass()));

        Map<String, ParameterValue> parameters = new LinkedHashMap<>(equipment.getAttributes());
        if (equipment.getTypeName() != null) {
            String defaultTypeName = definition
                    .map(d -> d.getDisplayName() != null ? d.getDisplayName() : d.getId())
                    .orElse(null);
            if (!equipment.getTypeName().equals(defaultTypeName)) {
                parameters.put(ComponentFactory.TYPE_NAME_PARAMETER, ParameterValue.ofString(equipment.getTypeName()));
            }
        }
        return Unit.builder()
                .name(name)
                .type(type)
                .parameters(parameters)
                .sequence(NamingUtil.indexOf(name))
                .build();
    }

    private static Stream toStream(String from, String to, PipingNetworkSegment segment, int index) {
        Stream stream = Stream.builder()
                .fromUnit(from)
                .toUnit(to)
                .name("s" + (index + 1))
                .build();
        copyTags(segment, stream);
        return stream;
    }

    private static void copyTags(PipingNetworkSegment segment, Stream stream) {
        for (CustomStringAttribute attribute : segment.getCustomAttributes()) {
            if (attribute.getAttributeName().startsWith(ConnectionBuilder.TAG_ATTRIBUTE_PREFIX)) {
                String kind = attribute.getAttributeName().substring(ConnectionBuilder.TAG_ATTRIBUTE_PREFIX.length());
                for (String value : attribute.getValue().split(",")) {
                    if (!value.isBlank()) {
                        stream.addTag(kind, value);
                    }
                }
            }
        }
    }

    private static Optional<String> sensedUnit(ProcessInstrumentationFunction function, Map<String, String> unitById) {
        return function.getSignalGeneratingFunctions().stream()
                .map(ProcessSignalGeneratingFunction::getSensingLocation)
                .filter(location -> location != null && unitById.containsKey(location))
                .map(unitById::get)
                .findFirst();
    }

    static String unitName(String tag) {
        return tag.toLowerCase(Locale.ROOT);
    }
}
