package com.plantmodel.flowsheet.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph with attribute maps on nodes and edges. Insertion order is preserved.
 */
public class LabeledGraph {

    private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    public record Edge(String from, String to, Map<String, Object> attributes) {
    }

    public Map<String, Object> addNode(String id) {
        return nodes.computeIfAbsent(id, k -> new LinkedHashMap<>());
    }

    public Map<String, Object> addNode(String id, Map<String, Object> attributes) {
        Map<String, Object> existing = addNode(id);
        if (attributes != null) {
            existing.putAll(attributes);
        }
        return existing;
    }

    public Edge addEdge(String from, String to) {
        return addEdge(from, to, Map.of());
    }

    public Edge addEdge(String from, String to, Map<String, Object> attributes) {
        addNode(from);
        addNode(to);
        Edge edge = new Edge(from, to, new LinkedHashMap<>(attributes));
        edges.add(edge);
        return edge;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public Map<String, Object> nodeAttributes(String id) {
        Map<String, Object> attributes = nodes.get(id);
        return attributes == null ? Map.of() : Collections.unmodifiableMap(attributes);
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /** Nodes with their attribute maps, in insertion order. */
    public Map<String, Map<String, Object>> nodesWithData() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> incomingEdges(String id) {
        return edges.stream().filter(e -> e.to().equals(id)).toList();
    }

    public List<Edge> outgoingEdges(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
