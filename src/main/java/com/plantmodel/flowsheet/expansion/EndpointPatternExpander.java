package com.plantmodel.flowsheet.expansion;

import java.util.ArrayList;
import java.util.List;

import com.plantmodel.flowsheet.template.ConnectionDslParser;

/**
 * Expands train patterns in connection endpoints.
 *
 * <ul>
 *   <li>{@code BFD...}: block boundary, kept as written</li>
 *   <li>{@code Basin-(*+1)}: next train, {@code Basin-2 .. Basin-T}</li>
 *   <li>{@code Basin-*}: every train, {@code Basin-1 .. Basin-T}</li>
 *   <li>{@code Basin-N}: last train only</li>
 *   <li>anything else: a literal instance key</li>
 * </ul>
 *
 * Endpoints produced from a per-train pattern carry the train slot they belong to, so two
 * patterned sides pair up train by train instead of as a cross product.
 */
public class EndpointPatternExpander {

    static final String NEXT_TRAIN = "(*+1)";
    static final String EVERY_TRAIN = "*";
    static final String LAST_TRAIN = "-N";

    /** An expanded endpoint. {@code slot} is the train the line was written for, or null. */
    public record Endpoint(String key, Integer slot) {

        public boolean isBoundary() {
            return ConnectionDslParser.isBoundary(key);
        }
    }

    public List<Endpoint> expand(String pattern, int trainCount) {
        List<Endpoint> endpoints = new ArrayList<>();
        if (ConnectionDslParser.isBoundary(pattern)) {
            endpoints.add(new Endpoint(pattern, null));
        } else if (pattern.contains(NEXT_TRAIN)) {
            String base = pattern.replace(NEXT_TRAIN, "");
            for (int train = 1; train < trainCount; train++) {
                endpoints.add(new Endpoint(base + (train + 1), train));
            }
        } else if (pattern.contains(EVERY_TRAIN)) {
            String base = pattern.replace(EVERY_TRAIN, "");
            for (int train = 1; train <= trainCount; train++) {
                endpoints.add(new Endpoint(base + train, train));
            }
        } else if (pattern.endsWith(LAST_TRAIN)) {
            String base = pattern.substring(0, pattern.length() - 1);
            endpoints.add(new Endpoint(base + trainCount, null));
        } else {
            endpoints.add(new Endpoint(pattern, null));
        }
        return endpoints;
    }

    /** Two endpoints pair unless both belong to different trains. */
    public static boolean pairs(Endpoint from, Endpoint to) {
        return from.slot() == null || to.slot() == null || from.slot().equals(to.slot());
    }
}
