package com.plantmodel.flowsheet.notation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.exception.NotationEmptyException;
import com.plantmodel.flowsheet.graph.LabeledGraph;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.ModelKind;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.util.NamingUtil;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Entry point for reading notation text.
 *
 * Text starting with {@code (} goes to the parenthesized reader, everything else to the
 * arrow reader. An input yielding no units is rejected.
 */
public class NotationParser {
    private static final Logger log = LoggerFactory.getLogger(NotationParser.class);

    /** Type-name fragments that mark a model as a block diagram. */
    static final Set<String> BLOCK_TYPE_FRAGMENTS = Set.of("reactor", "clarifier", "treatment", "separation");

    /** Unit parameter naming the process template a block expands into. */
    public static final String TEMPLATE_PARAMETER = "template";

    private final NativeNotationParser nativeParser;

    public NotationParser() {
        this(new ParenthesizedNotationReader());
    }

    public NotationParser(NativeNotationParser nativeParser) {
        this.nativeParser = nativeParser;
    }

    public IntermediateModel parse(String text) {
        if (text == null || text.isBlank()) {
            throw new NotationEmptyException(text == null ? "" : text);
        }
        String trimmed = text.strip();

        IntermediateModel model;
        if (trimmed.startsWith("(")) {
            log.debug("Reading parenthesized notation");
            model = fromGraph(nativeParser.parse(trimmed));
        } else {
            log.debug("Reading arrow notation");
            model = new LinearNotationReader().read(trimmed);
        }

        if (model.isEmpty()) {
            throw new NotationEmptyException(trimmed);
        }
        model.setKind(inferKind(model.getUnits()));
        log.info("Parsed notation: {} units, {} streams, kind {}",
                model.getUnits().size(), model.getStreams().size(), model.getKind());
        return model;
    }

    /**
     * Block diagram when any unit type contains one of the block fragments or a unit names
     * a template to expand.
     */
    static ModelKind inferKind(List<Unit> units) {
        for (Unit unit : units) {
            if (unit.hasParameter(TEMPLATE_PARAMETER)) {
                return ModelKind.BLOCK;
            }
            String type = unit.getType() == null ? "" : unit.getType().toLowerCase(Locale.ROOT);
            if (BLOCK_TYPE_FRAGMENTS.stream().anyMatch(type::contains)) {
                return ModelKind.BLOCK;
            }
        }
        return ModelKind.DETAILED;
    }

    @SuppressWarnings("unchecked")
    IntermediateModel fromGraph(LabeledGraph graph) {
        List<Unit> units = new ArrayList<>();
        graph.nodesWithData().forEach((id, attributes) -> {
            Object type = attributes.get(NativeNotationParser.TYPE_ATTRIBUTE);
            Map<String, ParameterValue> parameters = new LinkedHashMap<>();
            attributes.forEach((key, value) -> {
                if (!NativeNotationParser.TYPE_ATTRIBUTE.equals(key)) {
                    parameters.put(key, ParameterValue.of(value));
                }
            });
            units.add(Unit.builder()
                    .name(id)
                    .type(type != null ? type.toString() : NamingUtil.kindOf(id))
                    .sequence(NamingUtil.indexOf(id))
                    .parameters(parameters)
                    .build());
        });

        List<Stream> streams = new ArrayList<>();
        for (LabeledGraph.Edge edge : graph.edges()) {
            Stream stream = Stream.builder()
                    .fromUnit(edge.from())
                    .toUnit(edge.to())
                    .name("s" + (streams.size() + 1))
                    .build();
            Object tags = edge.attributes().get(NativeNotationParser.TAGS_ATTRIBUTE);
            if (tags instanceof Map<?, ?> tagMap) {
                tagMap.forEach((kind, values) -> {
                    for (Object v : (List<Object>) values) {
                        stream.addTag(String.valueOf(kind), String.valueOf(v));
                    }
                });
            }
            if (Boolean.TRUE.equals(edge.attributes().get(NativeNotationParser.RECYCLE_ATTRIBUTE))) {
                stream.getProperties().put(NativeNotationParser.RECYCLE_ATTRIBUTE, ParameterValue.ofBoolean(true));
            }
            streams.add(stream);
        }
        return IntermediateModel.builder().units(units).streams(streams).build();
    }
}
