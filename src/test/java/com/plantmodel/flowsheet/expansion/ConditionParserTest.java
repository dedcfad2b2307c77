package com.plantmodel.flowsheet.expansion;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.value.ParameterValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConditionParserTest {

    private final ConditionParser parser = new ConditionParser();

    private final Map<String, ParameterValue> params = Map.of(
            "aeration_type", ParameterValue.ofString("fine_bubble"),
            "do_control", ParameterValue.ofBoolean(false),
            "trains", ParameterValue.ofNumber(2));

    @Test
    void testTruthyPlaceholder() {
        assertThat(parser.parse("${do_control}").evaluate(params)).isFalse();
        assertThat(parser.parse("${missing|true}").evaluate(params)).isTrue();
        assertThat(parser.parse("${do_control}").parameterName()).isEqualTo("do_control");
    }

    @Test
    void testComparisons() {
        assertThat(parser.parse("${aeration_type} == fine_bubble").evaluate(params)).isTrue();
        assertThat(parser.parse("aeration_type != mechanical").evaluate(params)).isTrue();
        assertThat(parser.parse("${trains}==2.0").evaluate(params)).isTrue();
        assertThat(parser.parse("${do_control} == 'false'").evaluate(params)).isTrue();
    }

    @Test
    void testMissingParameterWithoutDefault() {
        Condition condition = parser.parse("${unknown} == x");

        assertThatThrownBy(() -> condition.evaluate(params))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "aeration_type",
            "${a} == ${b}",
            "a == b == c",
            "${a} > 3",
            "a and b"
    })
    void testUnsupportedShapesRejected(String expression) {
        assertThatThrownBy(() -> parser.parse(expression))
                .isInstanceOf(ConfigurationException.class);
    }
}
