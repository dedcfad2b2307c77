package com.plantmodel.flowsheet.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;

/**
 * A parameter value as found in unit parameter maps, template defaults and runtime overrides.
 *
 * Values are one of a closed set of kinds; consumers switch on {@link #kind()} instead of
 * probing the underlying Java type.
 */
public abstract class ParameterValue {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        MAP,
        LIST
    }

    private static final Set<String> TRUTHY_TOKENS = Set.of("true", "yes", "1", "on");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+([eE][-+]?\\d+)?|-?\\d+[eE][-+]?\\d+");

    ParameterValue() {
    }

    public abstract Kind kind();

    /**
     * Plain Java view: String, BigDecimal, Boolean, Map or List.
     */
    public abstract Object toJava();

    /**
     * Text rendering used by placeholder substitution and the notation writer.
     */
    public abstract String asText();

    /**
     * Truthiness used by template conditions. Strings are truthy when they are one of
     * {@code true, yes, 1, on} (case-insensitive).
     */
    public boolean isTruthy() {
        return switch (kind()) {
            case STRING -> TRUTHY_TOKENS.contains(asText().trim().toLowerCase(Locale.ROOT));
            case BOOLEAN -> ((BooleanValue) this).value;
            case NUMBER -> ((NumberValue) this).value.signum() != 0;
            case MAP -> !((MapValue) this).entries.isEmpty();
            case LIST -> !((ListValue) this).items.isEmpty();
        };
    }

    @Override
    public String toString() {
        return asText();
    }

    public static ParameterValue ofString(String value) {
        return new StringValue(value == null ? "" : value);
    }

    public static ParameterValue ofNumber(Number value) {
        return new NumberValue(value instanceof BigDecimal bd ? bd : new BigDecimal(value.toString()));
    }

    public static ParameterValue ofBoolean(boolean value) {
        return new BooleanValue(value);
    }

    /**
     * Converts a raw tree (as produced by the YAML reader) into parameter values.
     */
    public static ParameterValue of(Object raw) {
        if (raw == null) {
            return ofString("");
        }
        if (raw instanceof ParameterValue value) {
            return value;
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (raw instanceof Number n) {
            return ofNumber(n);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, ParameterValue> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
            return new MapValue(entries);
        }
        if (raw instanceof List<?> list) {
            List<ParameterValue> items = new ArrayList<>();
            for (Object item : list) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        return ofString(raw.toString());
    }

    /**
     * Coerces a literal written in notation or a condition: quoted text stays text,
     * {@code true/false} become booleans, integers and decimals become numbers.
     */
    public static ParameterValue coerce(String raw) {
        if (raw == null) {
            return ofString("");
        }
        String value = raw.trim();
        if (value.length() >= 2 && ((value.startsWith("'") && value.endsWith("'"))
                || (value.startsWith("\"") && value.endsWith("\"")))) {
            return ofString(value.substring(1, value.length() - 1));
        }
        String lowered = value.toLowerCase(Locale.ROOT);
        if (lowered.equals("true") || lowered.equals("false")) {
            return ofBoolean(lowered.equals("true"));
        }
        if (INTEGER.matcher(value).matches() || DECIMAL.matcher(value).matches()) {
            return ofNumber(new BigDecimal(value));
        }
        return ofString(value);
    }

    /**
     * Converts a whole map of raw values.
     */
    public static Map<String, ParameterValue> ofMap(Map<String, ?> raw) {
        Map<String, ParameterValue> result = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> result.put(k, of(v)));
        }
        return result;
    }

    /**
     * Loose equality used by {@code ==} / {@code !=} conditions: numbers compare numerically,
     * booleans against boolean-like text, everything else by text.
     */
    public boolean looselyEquals(ParameterValue other) {
        if (other == null) {
            return false;
        }
        if (kind() == Kind.NUMBER && other.kind() == Kind.NUMBER) {
            return ((NumberValue) this).value.compareTo(((NumberValue) other).value) == 0;
        }
        if (kind() == Kind.BOOLEAN || other.kind() == Kind.BOOLEAN) {
            return asText().equalsIgnoreCase(other.asText());
        }
        return asText().equals(other.asText());
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class StringValue extends ParameterValue {
        private final String value;

        StringValue(String value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class NumberValue extends ParameterValue {
        private final BigDecimal value;

        NumberValue(BigDecimal value) {
            this.value = value.stripTrailingZeros();
        }

        public BigDecimal getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return value.scale() <= 0 ? value.toBigInteger().toString() : value.toPlainString();
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class BooleanValue extends ParameterValue {
        private final boolean value;

        BooleanValue(boolean value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class MapValue extends ParameterValue {
        private final Map<String, ParameterValue> entries;

        MapValue(Map<String, ParameterValue> entries) {
            this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public Map<String, ParameterValue> getEntries() {
            return entries;
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        @Override
        public Object toJava() {
            Map<String, Object> java = new LinkedHashMap<>();
            entries.forEach((k, v) -> java.put(k, v.toJava()));
            return java;
        }

        @Override
        public String asText() {
            StringBuilder sb = new StringBuilder("{");
            entries.forEach((k, v) -> {
                if (sb.length() > 1) {
                    sb.append(", ");
                }
                sb.append(k).append('=').append(v.asText());
            });
            return sb.append('}').toString();
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class ListValue extends ParameterValue {
        private final List<ParameterValue> items;

        ListValue(List<ParameterValue> items) {
            this.items = List.copyOf(items);
        }

        public List<ParameterValue> getItems() {
            return items;
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public Object toJava() {
            return items.stream().map(ParameterValue::toJava).toList();
        }

        @Override
        public String asText() {
            return items.stream().map(ParameterValue::asText).toList().toString();
        }
    }
}
