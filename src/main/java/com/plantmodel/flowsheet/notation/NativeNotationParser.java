package com.plantmodel.flowsheet.notation;

import com.plantmodel.flowsheet.graph.LabeledGraph;

/**
 * Reader for the parenthesized grammar, e.g. {@code (raw)(pump)<1(tank)1(prod)}.
 *
 * Implementations populate a graph whose node ids are {@code kind-index} names. A node
 * may carry a {@code type} attribute; edges may carry a {@code tags} attribute holding a
 * {@code Map<String, List<String>>}.
 */
public interface NativeNotationParser {

    String TYPE_ATTRIBUTE = "type";
    String TAGS_ATTRIBUTE = "tags";
    String RECYCLE_ATTRIBUTE = "recycle";

    LabeledGraph parse(String text);
}
