package com.plantmodel.flowsheet.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * {@code ${name}} / {@code ${name|default}} substitution.
 */
public final class PlaceholderSubstitution {

    public static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}|]+)(?:\\|([^}]*))?\\}");

    private PlaceholderSubstitution() {
        // Utility class
    }

    public static boolean hasPlaceholder(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }

    /**
     * Replaces every placeholder. A name with no supplied value falls back to its default;
     * with neither the substitution fails.
     *
     * @throws ConfigurationException on an unresolved placeholder
     */
    public static String substitute(String text, Map<String, ParameterValue> params) {
        if (text == null || !text.contains("${")) {
            return text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(resolve(m, params, text).asText()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Replaces only placeholders whose name is supplied; everything else is left as written.
     */
    public static String substituteSupplied(String text, Map<String, ParameterValue> params) {
        if (text == null || !text.contains("${") || params.isEmpty()) {
            return text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1).trim();
            String replacement = params.containsKey(name) ? params.get(name).asText() : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Substitutes inside a value. A string consisting of exactly one placeholder takes the
     * typed value it resolves to, so {@code "${volume|2000}"} becomes the number 2000.
     */
    public static ParameterValue substitute(ParameterValue value, Map<String, ParameterValue> params) {
        return switch (value.kind()) {
            case STRING -> {
                String text = value.asText();
                Matcher whole = PLACEHOLDER.matcher(text.trim());
                if (whole.matches()) {
                    yield resolve(whole, params, text);
                }
                yield ParameterValue.ofString(substitute(text, params));
            }
            case NUMBER, BOOLEAN -> value;
            case MAP -> {
                Map<String, ParameterValue> entries = new LinkedHashMap<>();
                ((ParameterValue.MapValue) value).getEntries().forEach((k, v) -> entries.put(k, substitute(v, params)));
                yield ParameterValue.of(entries);
            }
            case LIST -> {
                List<ParameterValue> items = new ArrayList<>();
                ((ParameterValue.ListValue) value).getItems().forEach(v -> items.add(substitute(v, params)));
                yield ParameterValue.of(items);
            }
        };
    }

    /**
     * Value of a single placeholder match: the supplied value, else the coerced default.
     */
    static ParameterValue resolve(Matcher match, Map<String, ParameterValue> params, String context) {
        String name = match.group(1).trim();
        if (params.containsKey(name)) {
            return params.get(name);
        }
        String defaultValue = match.group(2);
        if (defaultValue == null) {
            throw new ConfigurationException("Unresolved placeholder '${" + name + "}' in '" + context
                    + "': no value supplied and no default");
        }
        return ParameterValue.coerce(defaultValue);
    }
}
