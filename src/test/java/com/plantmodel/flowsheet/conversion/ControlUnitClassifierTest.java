package com.plantmodel.flowsheet.conversion;

import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;
import com.plantmodel.flowsheet.plant.ProcessSignalGeneratingFunction;
import com.plantmodel.flowsheet.value.ParameterValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ControlUnitClassifierTest {

    private final ControlUnitClassifier classifier = new ControlUnitClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"FC-101", "lic-7", "TIC-3", "PC-1", "C-9"})
    void testControllerNames(String name) {
        assertThat(classifier.isControl(unit(name, null, Map.of()))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"pump-1", "tank", "fcv-1", "hex-2"})
    void testEquipmentNames(String name) {
        assertThat(classifier.isControl(unit(name, "pump", Map.of()))).isFalse();
    }

    @Test
    void testControlTypeOrParameterMarksController() {
        assertThat(classifier.isControl(unit("loop1", "control", Map.of()))).isTrue();
        assertThat(classifier.isControl(unit("loop2", "pump",
                Map.of("control_type", ParameterValue.ofString("LC"))))).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "FC-101, FC",
            "LIC-7, LIC",
            "tc-2, TC",
            "C-9, FC",
            "XC-4, FC"
    })
    void testControllerKindFromName(String name, String expected) {
        assertThat(classifier.controllerKind(unit(name, null, Map.of()))).isEqualTo(expected);
    }

    @Test
    void testExplicitControlTypeWins() {
        Unit unit = unit("C-9", "control", Map.of("control_type", ParameterValue.ofString("pic")));

        assertThat(classifier.controllerKind(unit)).isEqualTo("PIC");
    }

    @ParameterizedTest
    @CsvSource({
            "FC, Flow",
            "lic, Level",
            "TIC, Temperature",
            "PC, Pressure",
            "QC, Flow"
    })
    void testMeasuredVariable(String kind, String variable) {
        assertThat(classifier.measuredVariable(kind)).isEqualTo(variable);
    }

    @Test
    void testKindRecoveredFromSensorType() {
        ProcessInstrumentationFunction function = ProcessInstrumentationFunction.builder().tagName("X-1").build();
        function.getSignalGeneratingFunctions().add(
                ProcessSignalGeneratingFunction.builder().sensorType("Temperature").build());

        assertThat(classifier.controllerKindOf(function)).isEqualTo("TC");
        assertThat(classifier.controllerKindOf(ProcessInstrumentationFunction.builder().build())).isEqualTo("FC");
    }

    @Test
    void testInstrumentationFunctionTagSplit() {
        InstrumentationBuilder builder = new InstrumentationBuilder(classifier);
        Equipment tank = Equipment.builder().id("T-1").tagName("T-1").componentClass("Tank").build();

        ProcessInstrumentationFunction fic = builder.build("fic-12", "FIC", tank);
        ProcessInstrumentationFunction single = builder.build("C-3", "LC", null);

        assertThat(fic.getCategory()).isEqualTo("F");
        assertThat(fic.getModifier()).isEqualTo("IC");
        assertThat(fic.getNumber()).isEqualTo("12");
        assertThat(fic.getSignalGeneratingFunctions()).singleElement().satisfies(s -> {
            assertThat(s.getTagName()).isEqualTo("FIC-12_sensor");
            assertThat(s.getSensingLocation()).isEqualTo("T-1");
        });
        assertThat(fic.getActuatingFunctions()).extracting(a -> a.getTagName()).containsExactly("FIC-12_valve");

        assertThat(single.getCategory()).isEqualTo("L");
        assertThat(single.getModifier()).isEqualTo("C");
        assertThat(single.getNumber()).isEqualTo("3");
        assertThat(classifier.controllerKindOf(single)).isEqualTo("LC");
    }

    private static Unit unit(String name, String type, Map<String, ParameterValue> parameters) {
        return Unit.builder().name(name).type(type).parameters(new HashMap<>(parameters)).build();
    }
}
