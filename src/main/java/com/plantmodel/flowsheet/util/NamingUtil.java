package com.plantmodel.flowsheet.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming helpers shared by the notation readers, the writer and the reverse extractor.
 */
public class NamingUtil {

    private static final Pattern KIND_INDEX = Pattern.compile("^(.+?)-(\\d{1,9})$");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts CentrifugalPump to centrifugal_pump.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        result = result.replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
        result = result.replaceAll("[-\\s]+", "_");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Kind part of a {@code kind-index} unit name: {@code pump-2 -> pump}. Names without
     * a numeric suffix are returned unchanged.
     */
    public static String kindOf(String unitName) {
        if (unitName == null) {
            return null;
        }
        Matcher m = KIND_INDEX.matcher(unitName);
        return m.matches() ? m.group(1) : unitName;
    }

    /**
     * Numeric suffix of a {@code kind-index} unit name, or null.
     */
    public static Integer indexOf(String unitName) {
        if (unitName == null) {
            return null;
        }
        Matcher m = KIND_INDEX.matcher(unitName);
        return m.matches() ? Integer.valueOf(m.group(2)) : null;
    }
}
