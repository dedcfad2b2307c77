package com.plantmodel.flowsheet.notation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Writes an intermediate model as arrow notation.
 *
 * The main clause walks from the first unit without incoming streams, following the first
 * unused outgoing stream of each unit. Streams not on that walk follow as separate
 * {@code from->to} clauses, then units never mentioned. A unit is declared with its type
 * and parameters on first mention and referenced by bare name afterwards.
 *
 * In canonical mode units, streams, parameters and tags are sorted, so equal models always
 * produce identical text.
 */
public class NotationWriter {
    private static final Logger log = LoggerFactory.getLogger(NotationWriter.class);

    private static final Comparator<Stream> STREAM_ORDER = Comparator
            .comparing(Stream::getFromUnit)
            .thenComparing(Stream::getToUnit)
            .thenComparing(s -> s.getName() == null ? "" : s.getName());

    public String write(IntermediateModel model, boolean canonical, NotationVersion version) {
        List<Unit> units = new ArrayList<>(model.getUnits());
        List<Stream> streams = new ArrayList<>(model.getStreams());
        if (canonical) {
            units.sort(Comparator.comparing(Unit::getName));
            streams.sort(STREAM_ORDER);
        }

        Map<String, Unit> byName = new LinkedHashMap<>();
        units.forEach(u -> byName.put(u.getName(), u));

        Set<String> declared = new HashSet<>();
        Set<Stream> covered = Collections.newSetFromMap(new IdentityHashMap<>());
        List<String> clauses = new ArrayList<>();

        if (!units.isEmpty()) {
            Set<String> withIncoming = streams.stream().map(Stream::getToUnit).collect(Collectors.toSet());
            Unit start = units.stream()
                    .filter(u -> !withIncoming.contains(u.getName()))
                    .findFirst()
                    .orElse(units.get(0));

            StringBuilder main = new StringBuilder(render(start.getName(), byName, declared));
            Set<String> onPath = new HashSet<>();
            onPath.add(start.getName());
            String current = start.getName();
            while (true) {
                Stream next = firstUnusedOutgoing(current, streams, covered, onPath);
                if (next == null) {
                    break;
                }
                covered.add(next);
                main.append(renderTags(next, canonical, version))
                        .append("->")
                        .append(render(next.getToUnit(), byName, declared));
                current = next.getToUnit();
                onPath.add(current);
            }
            clauses.add(main.toString());
        }

        for (Stream stream : streams) {
            if (covered.contains(stream)) {
                continue;
            }
            clauses.add(render(stream.getFromUnit(), byName, declared)
                    + renderTags(stream, canonical, version)
                    + "->"
                    + render(stream.getToUnit(), byName, declared));
        }

        for (Unit unit : units) {
            if (!declared.contains(unit.getName())) {
                clauses.add(render(unit.getName(), byName, declared));
            }
        }

        String text = String.join(" ", clauses);
        log.debug("Wrote {} clauses ({} chars)", clauses.size(), text.length());
        return text;
    }

    private static Stream firstUnusedOutgoing(String unit, List<Stream> streams, Set<Stream> covered, Set<String> onPath) {
        for (Stream stream : streams) {
            if (stream.getFromUnit().equals(unit) && !covered.contains(stream) && !onPath.contains(stream.getToUnit())) {
                return stream;
            }
        }
        return null;
    }

    private String render(String name, Map<String, Unit> byName, Set<String> declared) {
        if (!declared.add(name)) {
            return name;
        }
        Unit unit = byName.get(name);
        if (unit == null) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name);
        if (unit.getType() != null && !unit.getType().isBlank()) {
            sb.append('[').append(unit.getType()).append(']');
        }
        String parameters = renderParameters(unit.getParameters());
        if (!parameters.isEmpty()) {
            sb.append('(').append(parameters).append(')');
        }
        return sb.toString();
    }

    private String renderParameters(Map<String, ParameterValue> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }
        // parameter order is always sorted so that declarations are stable
        return new TreeMap<>(parameters).entrySet().stream()
                .filter(e -> renderable(e.getValue()))
                .map(e -> e.getKey() + "=" + renderValue(e.getValue()))
                .collect(Collectors.joining(","));
    }

    private static boolean renderable(ParameterValue value) {
        return switch (value.kind()) {
            case STRING, NUMBER, BOOLEAN -> true;
            case MAP, LIST -> false;
        };
    }

    static String renderValue(ParameterValue value) {
        String text = value.asText();
        if (value.kind() != ParameterValue.Kind.STRING) {
            return text;
        }
        boolean needsQuotes = text.isEmpty()
                || ParameterValue.coerce(text).kind() != ParameterValue.Kind.STRING
                || !text.chars().allMatch(c -> NotationTokenizer.isIdentifierChar((char) c))
                || text.contains("->");
        return needsQuotes ? "'" + text.replace("'", "") + "'" : text;
    }

    private String renderTags(Stream stream, boolean canonical, NotationVersion version) {
        if (version == NotationVersion.V1 || !stream.hasTags()) {
            return "";
        }
        Map<String, List<String>> tags = canonical ? new TreeMap<>(stream.getTags()) : stream.getTags();
        StringBuilder sb = new StringBuilder();
        tags.forEach((kind, values) -> {
            List<String> ordered = new ArrayList<>(values);
            if (canonical) {
                ordered.sort(Comparator.naturalOrder());
            }
            if (!ordered.isEmpty()) {
                sb.append('{').append(kind).append(':').append(String.join(",", ordered)).append('}');
            }
        });
        return sb.toString();
    }
}
