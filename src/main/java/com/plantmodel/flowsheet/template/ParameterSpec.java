package com.plantmodel.flowsheet.template;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Declared template parameter: type tag, default, allowed values, numeric bounds and
 * the template parts it affects.
 */
@Value
@Builder(toBuilder = true)
public class ParameterSpec {
    String name;

    @Builder.Default
    String type = "string";

    ParameterValue defaultValue;

    @Singular
    List<ParameterValue> values;

    BigDecimal min;
    BigDecimal max;

    @Singular("affect")
    List<String> affects;

    /**
     * Checks a runtime value against the declared values and bounds.
     *
     * @throws ConfigurationException when the value is not allowed
     */
    public void validate(ParameterValue value) {
        if (value == null) {
            return;
        }
        if (!values.isEmpty() && values.stream().noneMatch(v -> v.looselyEquals(value))) {
            throw new ConfigurationException("Parameter '" + name + "' value '" + value.asText()
                    + "' is not one of " + values.stream().map(ParameterValue::asText).toList());
        }
        if (isNumeric() || min != null || max != null) {
            BigDecimal number = numeric(value);
            if (min != null && number.compareTo(min) < 0) {
                throw new ConfigurationException("Parameter '" + name + "' value " + value.asText()
                        + " is below the minimum " + min.toPlainString());
            }
            if (max != null && number.compareTo(max) > 0) {
                throw new ConfigurationException("Parameter '" + name + "' value " + value.asText()
                        + " is above the maximum " + max.toPlainString());
            }
        }
    }

    public boolean isNumeric() {
        String t = type == null ? "" : type.toLowerCase(Locale.ROOT);
        return t.equals("integer") || t.equals("int") || t.equals("float") || t.equals("number");
    }

    private BigDecimal numeric(ParameterValue value) {
        return switch (value.kind()) {
            case NUMBER -> ((ParameterValue.NumberValue) value).getValue();
            case STRING -> {
                ParameterValue coerced = ParameterValue.coerce(value.asText());
                if (coerced.kind() != ParameterValue.Kind.NUMBER) {
                    throw new ConfigurationException("Parameter '" + name + "' expects a number, got '"
                            + value.asText() + "'");
                }
                yield ((ParameterValue.NumberValue) coerced).getValue();
            }
            case BOOLEAN, MAP, LIST -> throw new ConfigurationException("Parameter '" + name
                    + "' expects a number, got " + value.kind().name().toLowerCase(Locale.ROOT));
        };
    }
}
