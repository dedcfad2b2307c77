package com.plantmodel.flowsheet.notation;

import com.plantmodel.flowsheet.exception.NotationEmptyException;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.ModelKind;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.value.ParameterValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for both notation grammars behind {@link NotationParser}.
 */
class NotationParserTest {

    private final NotationParser parser = new NotationParser();

    @Test
    void testArrowNotationWithTypes() {
        IntermediateModel model = parser.parse("pump[pump_centrifugal]->tank[tank]");

        assertThat(model.unitNames()).containsExactly("pump", "tank");
        assertThat(model.findUnit("pump")).map(Unit::getType).hasValue("pump_centrifugal");
        assertThat(model.getStreams()).singleElement()
                .satisfies(s -> {
                    assertThat(s.getFromUnit()).isEqualTo("pump");
                    assertThat(s.getToUnit()).isEqualTo("tank");
                });
        assertThat(model.getKind()).isEqualTo(ModelKind.DETAILED);
    }

    @Test
    void testParametersAreCoerced() {
        IntermediateModel model = parser.parse("p-1[pump](flowRate=12.5,spare=true,label='main feed')");

        Unit pump = model.findUnit("p-1").orElseThrow();
        assertThat(pump.getParameter("flowRate").kind()).isEqualTo(ParameterValue.Kind.NUMBER);
        assertThat(pump.getParameter("spare").isTruthy()).isTrue();
        assertThat(pump.getParameter("label").asText()).isEqualTo("main feed");
        assertThat(pump.getSequence()).isEqualTo(1);
    }

    @Test
    void testUntypedUnitTakesKindOfName() {
        IntermediateModel model = parser.parse("hex-3->pump-1");

        assertThat(model.findUnit("hex-3")).map(Unit::getType).hasValue("hex");
        assertThat(model.findUnit("pump-1")).map(Unit::getSequence).hasValue(1);
    }

    @Test
    void testLaterReferencesReuseTheDeclaration() {
        IntermediateModel model = parser.parse("a[tank]->b[pump] b->c[tank] a->c");

        assertThat(model.getUnits()).hasSize(3);
        assertThat(model.getStreams()).extracting(s -> s.getFromUnit() + ">" + s.getToUnit())
                .containsExactly("a>b", "b>c", "a>c");
        assertThat(model.findUnit("b")).map(Unit::getType).hasValue("pump");
    }

    @Test
    void testTagsAttachToTheFollowingStream() {
        IntermediateModel model = parser.parse("a{signal:not_next_unitop}->b c->d{kind:x}");

        Stream first = model.getStreams().get(0);
        assertThat(first.getTags()).containsEntry("signal", List.of("not_next_unitop"));
        Stream second = model.getStreams().get(1);
        assertThat(second.getTags()).containsEntry("kind", List.of("x"));
    }

    @Test
    void testParenthesizedNotationNumbersUnits() {
        IntermediateModel model = parser.parse("(raw)(pump)(hex)(pump)(prod)");

        assertThat(model.unitNames()).containsExactly("raw-1", "pump-1", "hex-1", "pump-2", "prod-1");
        assertThat(model.findUnit("raw-1")).map(Unit::getType).hasValue("feed");
        assertThat(model.findUnit("prod-1")).map(Unit::getType).hasValue("product");
        assertThat(model.getStreams()).hasSize(4);
    }

    @Test
    void testParenthesizedBranchAndRecycle() {
        IntermediateModel model = parser.parse("(raw)(r)<1[(splt)(prod)](hex)1");

        assertThat(model.getStreams()).extracting(s -> s.getFromUnit() + ">" + s.getToUnit())
                .contains("raw-1>r-1", "r-1>splt-1", "splt-1>prod-1", "r-1>hex-1", "hex-1>r-1");
        assertThat(model.getStreams())
                .filteredOn(s -> s.getProperties().containsKey(NativeNotationParser.RECYCLE_ATTRIBUTE))
                .singleElement()
                .satisfies(s -> assertThat(s.getFromUnit()).isEqualTo("hex-1"));
    }

    @Test
    void testParenthesizedTagsOnIncomingStream() {
        IntermediateModel model = parser.parse("(raw)(pump){tag:hot}");

        assertThat(model.getStreams().get(0).getTags()).containsEntry("tag", List.of("hot"));
    }

    @Test
    void testBlockDiagramDetection() {
        assertThat(parser.parse("feed->reactor-1[reactor]").getKind()).isEqualTo(ModelKind.BLOCK);
        assertThat(parser.parse("basin(template=TK)").getKind()).isEqualTo(ModelKind.BLOCK);
        assertThat(parser.parse("feed->pump").getKind()).isEqualTo(ModelKind.DETAILED);
    }

    @Test
    void testEmptyInputRejected() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(NotationEmptyException.class);
        assertThatThrownBy(() -> parser.parse("-> ->"))
                .isInstanceOf(NotationEmptyException.class);
    }
}
