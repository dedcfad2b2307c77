package com.plantmodel.flowsheet.notation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.graph.LabeledGraph;
import com.plantmodel.flowsheet.notation.NotationToken.TokenType;

/**
 * Parenthesized grammar reader.
 *
 * <ul>
 *   <li>{@code (name)} declares a unit; units of the same kind are numbered {@code name-1, name-2}</li>
 *   <li>consecutive units are connected in order</li>
 *   <li>{@code [ ... ]} opens a branch from the current unit; after {@code ]} the main line
 *       continues from the branch point</li>
 *   <li>{@code <n} marks the current unit as recycle target, a bare {@code n} as recycle source</li>
 *   <li>{@code {tag}} annotates the stream entering the current unit</li>
 *   <li>{@code |} starts an independent line</li>
 * </ul>
 * {@code raw} and {@code prod} units are typed {@code feed} and {@code product}.
 */
public class ParenthesizedNotationReader implements NativeNotationParser {
    private static final Logger log = LoggerFactory.getLogger(ParenthesizedNotationReader.class);

    private static final Map<String, String> KIND_ALIASES = Map.of(
            "raw", "feed",
            "prod", "product"
    );

    private record RecycleMarker(String node, boolean target) {
    }

    @Override
    public LabeledGraph parse(String text) {
        List<NotationToken> tokens = new NotationTokenizer(text).tokenize();
        LabeledGraph graph = new LabeledGraph();
        Map<String, Integer> counters = new HashMap<>();
        Map<String, RecycleMarker> openRecycles = new HashMap<>();
        Deque<String> branchPoints = new ArrayDeque<>();

        String current = null;
        LabeledGraph.Edge incoming = null;
        Map<String, List<String>> pendingTags = new LinkedHashMap<>();

        int i = 0;
        while (i < tokens.size() && !tokens.get(i).is(TokenType.EOF)) {
            NotationToken token = tokens.get(i);
            switch (token.getType()) {
                case LPAREN -> {
                    StringBuilder word = new StringBuilder();
                    i++;
                    while (i < tokens.size() && !tokens.get(i).is(TokenType.RPAREN) && !tokens.get(i).is(TokenType.EOF)) {
                        word.append(tokens.get(i).getValue());
                        i++;
                    }
                    String kind = word.toString().trim().replaceAll("\\s+", "_").toLowerCase(Locale.ROOT);
                    int index = counters.merge(kind, 1, Integer::sum);
                    String node = kind + "-" + index;
                    graph.addNode(node, Map.of(TYPE_ATTRIBUTE, KIND_ALIASES.getOrDefault(kind, kind)));

                    incoming = null;
                    if (current != null) {
                        Map<String, Object> attributes = new LinkedHashMap<>();
                        if (!pendingTags.isEmpty()) {
                            attributes.put(TAGS_ATTRIBUTE, new LinkedHashMap<>(pendingTags));
                            pendingTags.clear();
                        }
                        incoming = graph.addEdge(current, node, attributes);
                    }
                    current = node;
                }
                case LBRACE -> {
                    StringBuilder tag = new StringBuilder();
                    i++;
                    while (i < tokens.size() && !tokens.get(i).is(TokenType.RBRACE) && !tokens.get(i).is(TokenType.EOF)) {
                        tag.append(tokens.get(i).getValue());
                        i++;
                    }
                    attachTag(tag.toString().trim(), incoming, pendingTags);
                }
                case LBRACKET -> {
                    if (current != null) {
                        branchPoints.push(current);
                    }
                }
                case RBRACKET -> {
                    if (!branchPoints.isEmpty()) {
                        current = branchPoints.pop();
                        incoming = null;
                    }
                }
                case LESS_THAN -> {
                    if (i + 1 < tokens.size() && tokens.get(i + 1).is(TokenType.IDENTIFIER) && current != null) {
                        i++;
                        closeOrOpenRecycle(graph, openRecycles, tokens.get(i).getValue(), current, true);
                    }
                }
                case IDENTIFIER -> {
                    if (current != null && token.getValue().chars().allMatch(Character::isDigit)) {
                        closeOrOpenRecycle(graph, openRecycles, token.getValue(), current, false);
                    } else {
                        log.debug("Skipping identifier '{}' outside a unit at position {}", token.getValue(), token.getPosition());
                    }
                }
                case PIPE -> {
                    current = null;
                    incoming = null;
                    branchPoints.clear();
                }
                default -> log.trace("Ignoring token {}", token);
            }
            i++;
        }

        if (!openRecycles.isEmpty()) {
            log.debug("Unmatched recycle markers: {}", openRecycles.keySet());
        }
        log.debug("Parenthesized notation yielded {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    @SuppressWarnings("unchecked")
    private static void attachTag(String tag, LabeledGraph.Edge incoming, Map<String, List<String>> pendingTags) {
        if (tag.isEmpty()) {
            return;
        }
        String kind = "tag";
        String value = tag;
        int colon = tag.indexOf(':');
        if (colon > 0) {
            kind = tag.substring(0, colon).trim();
            value = tag.substring(colon + 1).trim();
        }
        Map<String, List<String>> target = pendingTags;
        if (incoming != null) {
            target = (Map<String, List<String>>) incoming.attributes()
                    .computeIfAbsent(TAGS_ATTRIBUTE, k -> new LinkedHashMap<String, List<String>>());
        }
        List<String> values = target.computeIfAbsent(kind, k -> new ArrayList<>());
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
    }

    private static void closeOrOpenRecycle(LabeledGraph graph, Map<String, RecycleMarker> open,
                                           String number, String node, boolean target) {
        RecycleMarker earlier = open.remove(number);
        if (earlier == null) {
            open.put(number, new RecycleMarker(node, target));
            return;
        }
        String from = target ? earlier.node() : node;
        String to = target ? node : earlier.node();
        graph.addEdge(from, to, Map.of(RECYCLE_ATTRIBUTE, Boolean.TRUE));
    }
}
