package com.plantmodel.flowsheet.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.exception.ConfigurationException;

/**
 * Parses connection lines of the form {@code Source[.port] -> Target[.port]}.
 *
 * Ports default to {@code outlet} / {@code inlet}. {@code #} starts a comment. Endpoints may
 * carry train patterns ({@code Basin-*}, {@code Basin-(*+1)}, {@code Basin-N}); lines that
 * touch the block boundary keep the original line as port mapping.
 */
public class ConnectionDslParser {
    private static final Logger log = LoggerFactory.getLogger(ConnectionDslParser.class);

    public static final String BOUNDARY_MARKER = "BFD";
    public static final String DEFAULT_SOURCE_PORT = "outlet";
    public static final String DEFAULT_TARGET_PORT = "inlet";

    /** Endpoint text: ids, train patterns and {@code ${name|default}} placeholders. */
    private static final String ENDPOINT = "((?:\\$\\{[^}]*\\}|[A-Za-z0-9_\\-*+()])+)";

    private static final Pattern LINE = Pattern.compile(
            ENDPOINT + "\\.?([A-Za-z0-9_]*)\\s*->\\s*" + ENDPOINT + "\\.?([A-Za-z0-9_]*)");

    public List<ConnectionSpec> parse(String dsl) {
        List<ConnectionSpec> connections = new ArrayList<>();
        if (dsl == null) {
            return connections;
        }
        for (String rawLine : dsl.split("\\R")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) {
                continue;
            }
            connections.add(parseLine(line));
        }
        log.debug("Parsed {} connection lines", connections.size());
        return connections;
    }

    /**
     * @throws ConfigurationException when the line is not a connection
     */
    public ConnectionSpec parseLine(String line) {
        String text = stripComment(line).trim();
        Matcher m = LINE.matcher(text);
        if (!m.matches()) {
            throw new ConfigurationException("Malformed connection line: '" + text
                    + "'. Expected 'Source[.port] -> Target[.port]'");
        }
        String from = m.group(1);
        String to = m.group(3);
        boolean boundary = isBoundary(from) || isBoundary(to);
        return ConnectionSpec.builder()
                .fromEquipment(from)
                .fromPort(m.group(2).isEmpty() ? DEFAULT_SOURCE_PORT : m.group(2))
                .toEquipment(to)
                .toPort(m.group(4).isEmpty() ? DEFAULT_TARGET_PORT : m.group(4))
                .portMapping(boundary ? text : null)
                .build();
    }

    /** Boundary endpoints start with the marker, e.g. {@code BFD.inlet}. */
    public static boolean isBoundary(String endpoint) {
        return endpoint != null && endpoint.startsWith(BOUNDARY_MARKER);
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}
