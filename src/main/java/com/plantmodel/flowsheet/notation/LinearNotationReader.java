package com.plantmodel.flowsheet.notation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.notation.NotationToken.TokenType;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.util.NamingUtil;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Reader for the arrow grammar: {@code name[type](key=value,...)->name[type]}.
 *
 * Clauses are separated by whitespace. Within a clause every arrow connects the two
 * adjacent unit references. {@code {kind:v1,v2}} tag blocks between two units belong to
 * the stream joining them. A unit may be declared once with its type and referenced
 * by bare name afterwards; units never given a type take the kind part of their name.
 */
public class LinearNotationReader {
    private static final Logger log = LoggerFactory.getLogger(LinearNotationReader.class);

    private List<NotationToken> tokens;
    private int current;
    private Map<String, Unit> units;
    private List<Stream> streams;

    public IntermediateModel read(String text) {
        tokens = new NotationTokenizer(text).tokenize();
        current = 0;
        units = new LinkedHashMap<>();
        streams = new ArrayList<>();

        Unit previous = null;
        boolean arrowPending = false;
        Map<String, List<String>> pendingTags = new LinkedHashMap<>();
        Stream lastInClause = null;

        while (!check(TokenType.EOF)) {
            NotationToken token = peek();
            switch (token.getType()) {
                case SEPARATOR -> {
                    advance();
                    if (arrowPending || check(TokenType.ARROW) || check(TokenType.LBRACE)) {
                        continue;
                    }
                    flushTrailingTags(pendingTags, lastInClause);
                    previous = null;
                    lastInClause = null;
                }
                case ARROW -> {
                    advance();
                    if (previous == null) {
                        log.debug("Ignoring arrow without source at position {}", token.getPosition());
                    } else {
                        arrowPending = true;
                    }
                }
                case LBRACE -> {
                    advance();
                    readTagBlock(pendingTags);
                }
                case IDENTIFIER -> {
                    Unit unit = readUnitReference();
                    if (arrowPending && previous != null) {
                        Stream stream = Stream.builder()
                                .fromUnit(previous.getName())
                                .toUnit(unit.getName())
                                .name("s" + (streams.size() + 1))
                                .build();
                        pendingTags.forEach((kind, values) -> values.forEach(v -> stream.addTag(kind, v)));
                        pendingTags.clear();
                        streams.add(stream);
                        lastInClause = stream;
                    }
                    arrowPending = false;
                    previous = unit;
                }
                default -> {
                    log.debug("Skipping unexpected token '{}' at position {}", token.getValue(), token.getPosition());
                    advance();
                }
            }
        }
        flushTrailingTags(pendingTags, lastInClause);

        for (Unit unit : units.values()) {
            if (unit.getType() == null || unit.getType().isBlank()) {
                unit.setType(NamingUtil.kindOf(unit.getName()));
            }
            if (unit.getSequence() == null) {
                unit.setSequence(NamingUtil.indexOf(unit.getName()));
            }
        }

        log.debug("Arrow notation yielded {} units and {} streams", units.size(), streams.size());
        return IntermediateModel.builder()
                .units(new ArrayList<>(units.values()))
                .streams(streams)
                .build();
    }

    private void flushTrailingTags(Map<String, List<String>> pendingTags, Stream lastInClause) {
        if (!pendingTags.isEmpty() && lastInClause != null) {
            pendingTags.forEach((kind, values) -> values.forEach(v -> lastInClause.addTag(kind, v)));
        }
        pendingTags.clear();
    }

    private Unit readUnitReference() {
        String name = advance().getValue();
        Unit unit = units.computeIfAbsent(name, n -> Unit.builder().name(n).build());

        if (check(TokenType.LBRACKET)) {
            advance();
            String type = readUntil(TokenType.RBRACKET);
            if (unit.getType() == null && !type.isBlank()) {
                unit.setType(type.trim());
            }
        }
        if (check(TokenType.LPAREN)) {
            advance();
            unit.getParameters().putAll(readProperties());
        }
        return unit;
    }

    private Map<String, ParameterValue> readProperties() {
        Map<String, ParameterValue> properties = new LinkedHashMap<>();
        while (!check(TokenType.EOF) && !check(TokenType.RPAREN)) {
            skipSeparators();
            if (!check(TokenType.IDENTIFIER)) {
                advance();
                continue;
            }
            String key = advance().getValue();
            skipSeparators();
            if (!check(TokenType.EQUALS)) {
                log.debug("Property '{}' has no value", key);
                continue;
            }
            advance();
            skipSeparators();
            StringBuilder raw = new StringBuilder();
            while (!check(TokenType.EOF) && !check(TokenType.COMMA) && !check(TokenType.RPAREN)) {
                raw.append(advance().getValue());
            }
            properties.put(key, ParameterValue.coerce(raw.toString()));
            if (check(TokenType.COMMA)) {
                advance();
            }
        }
        if (check(TokenType.RPAREN)) {
            advance();
        }
        return properties;
    }

    private void readTagBlock(Map<String, List<String>> into) {
        String kind = "tag";
        List<String> values = new ArrayList<>();
        StringBuilder currentValue = new StringBuilder();
        while (!check(TokenType.EOF) && !check(TokenType.RBRACE)) {
            NotationToken token = advance();
            switch (token.getType()) {
                case COLON -> {
                    kind = currentValue.toString().trim();
                    currentValue.setLength(0);
                }
                case COMMA -> {
                    addTagValue(values, currentValue);
                }
                case SEPARATOR -> {
                    // whitespace inside a tag block carries no meaning
                }
                default -> currentValue.append(token.getValue());
            }
        }
        addTagValue(values, currentValue);
        if (check(TokenType.RBRACE)) {
            advance();
        }
        if (!values.isEmpty()) {
            into.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(values);
        }
    }

    private static void addTagValue(List<String> values, StringBuilder currentValue) {
        String value = currentValue.toString().trim();
        if (!value.isEmpty()) {
            values.add(value);
        }
        currentValue.setLength(0);
    }

    private String readUntil(TokenType terminator) {
        StringBuilder sb = new StringBuilder();
        while (!check(TokenType.EOF) && !check(terminator)) {
            sb.append(advance().getValue());
        }
        if (check(terminator)) {
            advance();
        }
        return sb.toString();
    }

    private void skipSeparators() {
        while (check(TokenType.SEPARATOR)) {
            advance();
        }
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private NotationToken peek() {
        return tokens.get(current);
    }

    private NotationToken advance() {
        NotationToken token = tokens.get(current);
        if (current < tokens.size() - 1) {
            current++;
        }
        return token;
    }
}
