package com.plantmodel.flowsheet.conversion;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.context.ConverterContext;
import com.plantmodel.flowsheet.exception.InvalidStreamReferenceException;
import com.plantmodel.flowsheet.exception.UnknownComponentTypeException;
import com.plantmodel.flowsheet.graph.ConnectivityGraphProjector;
import com.plantmodel.flowsheet.notation.NotationVersion;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.PipingNetworkSegment;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;
import com.plantmodel.flowsheet.value.ParameterValue;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for notation to plant model conversion and back.
 */
class ConversionEngineTest {

    private static ConversionEngine engine;

    @BeforeAll
    static void createEngine() {
        engine = ConverterContext.create(ConverterConfig.builder().build()).getConversionEngine();
    }

    @Test
    void testPumpToTank() {
        PlantModel model = engine.toStructuredModel("pump[pump_centrifugal]->tank[tank]", false, null);

        assertThat(model.getConceptualModel().getEquipment()).extracting(Equipment::getComponentClass)
                .containsExactly("CentrifugalPump", "Tank");
        assertThat(model.getConceptualModel().allSegments()).singleElement().satisfies(segment -> {
            assertThat(segment.getId()).isEqualTo("segment__PUMP__TANK");
            assertThat(segment.isLinked()).isTrue();
            assertThat(segment.getPipingClass()).isEqualTo("CS150");
        });

        String notation = engine.notationOf(model, true, NotationVersion.V2);
        assertThat(notation).containsPattern("pump.*->.*tank");
    }

    @Test
    void testLoneControllerHasNoSensingLocation() {
        PlantModel model = engine.toStructuredModel("FC-101", false, null);

        assertThat(model.getConceptualModel().getEquipment()).isEmpty();
        assertThat(model.getConceptualModel().getInstrumentationFunctions()).singleElement().satisfies(function -> {
            assertThat(function.getTagName()).isEqualTo("FC-101");
            assertThat(function.getSignalGeneratingFunctions()).singleElement()
                    .satisfies(sensor -> assertThat(sensor.getSensingLocation()).isNull());
        });
    }

    @Test
    void testControllerMeasuresUpstreamEquipment() {
        PlantModel model = engine.toStructuredModel("tank-1[tank]->pump-1[pump] tank-1->LIC-7", false, null);

        ProcessInstrumentationFunction function = model.getConceptualModel().getInstrumentationFunctions().get(0);
        assertThat(function.getCategory()).isEqualTo("L");
        assertThat(function.getModifier()).isEqualTo("IC");
        assertThat(function.getNumber()).isEqualTo("7");
        assertThat(function.customAttribute(ControlUnitClassifier.CONTROL_TYPE_ATTRIBUTE)).hasValue("LIC");
        assertThat(function.getSignalGeneratingFunctions().get(0).getSensingLocation()).isEqualTo("TANK-1");
        assertThat(function.getSignalGeneratingFunctions().get(0).getSensorType()).isEqualTo("Level");
        assertThat(model.getConceptualModel().allSegments()).hasSize(1);
    }

    @Test
    void testStreamToUnknownUnitRejected() {
        IntermediateModel model = engine.parse("pump[pump]->tank[tank]");
        model.getStreams().get(0).setToUnit("ghost");

        assertThatThrownBy(() -> engine.toStructuredModel(model, false, null))
                .isInstanceOf(InvalidStreamReferenceException.class)
                .hasMessageContaining("ghost")
                .hasMessageContaining("pump")
                .hasMessageContaining("tank")
                .satisfies(e -> assertThat(((InvalidStreamReferenceException) e).getRole()).isEqualTo("target"));
    }

    @Test
    void testUnknownTypeMessageListsKnownTypes() {
        assertThatThrownBy(() -> engine.resolveType("definitely_not_a_real_type"))
                .isInstanceOf(UnknownComponentTypeException.class)
                .hasMessageContaining("pump")
                .hasMessageContaining("tank");
    }

    @Test
    void testParallelStreamsGetDistinctSegments() {
        PlantModel model = engine.toStructuredModel("a[tank]->b[tank] a->b", false, null);

        assertThat(model.getConceptualModel().allSegments()).extracting(PipingNetworkSegment::getId)
                .containsExactly("segment__A__B", "segment__A__B__2");
        assertThat(engine.fromStructuredModel(model).getStreams()).hasSize(2);
    }

    @Test
    void testTagsSurviveTheModel() {
        PlantModel model = engine.toStructuredModel("a[tank]{he:HE101}->b[hex]", false, null);

        assertThat(model.getConceptualModel().allSegments().get(0).customAttribute("tag:he")).hasValue("HE101");
        assertThat(engine.notationOf(model, true, NotationVersion.V2)).contains("{he:HE101}");
        assertThat(engine.notationOf(model, true, NotationVersion.V1)).doesNotContain("{");
    }

    @Test
    void testReverseConversionWritesControllers() {
        PlantModel model = engine.toStructuredModel("feed[feed]->p-1[pump] p-1->FC-3", false, null);

        IntermediateModel extracted = engine.fromStructuredModel(model);

        Unit controller = extracted.findUnit("fc-3").orElseThrow();
        assertThat(controller.getType()).isEqualTo("control");
        assertThat(controller.getParameter("control_type").asText()).isEqualTo("FC");
        assertThat(extracted.getStreams()).filteredOn(s -> s.getToUnit().equals("fc-3"))
                .singleElement()
                .satisfies(s -> assertThat(s.getTags()).containsEntry("signal", List.of("not_next_unitop")));
    }

    @Test
    void testCustomEquipmentTypeNameIsPreserved() {
        PlantModel model = engine.toStructuredModel("x[custom](typeName=Skimmer)->t[tank]", false, null);

        assertThat(model.getConceptualModel().findEquipment("X")).map(Equipment::getTypeName).hasValue("Skimmer");
        assertThat(engine.fromStructuredModel(model).findUnit("x"))
                .hasValueSatisfying(u -> assertThat(u.getParameter("typeName").asText()).isEqualTo("Skimmer"));
    }

    @Test
    void testNotationRoundTripIsLossless() {
        RoundTripReport report = engine.roundTripCheck("feed[feed]->P-101[pump]->hex-1[hex]->prod[product] P-101->FC-101");

        assertThat(report.getDirection()).isEqualTo(RoundTripReport.Direction.NOTATION_TO_MODEL_TO_NOTATION);
        assertThat(report.getDifferences()).isEmpty();
        assertThat(report.isValid()).isTrue();
    }

    @Test
    void testParenthesizedRoundTrip() {
        RoundTripReport report = engine.roundTripCheck("(raw)(pump)<1[(splt)(prod)](hex)1");

        assertThat(report.isValid()).as(report.getDifferences().toString()).isTrue();
    }

    @Test
    void testModelRoundTripIsLossless() {
        PlantModel model = engine.toStructuredModel("tank-1[tank]->pump-1[pump]->tank-2[tank] tank-2->LC-5", false,
                Map.of("project", "demo"));

        RoundTripReport report = engine.roundTripCheck(model);

        assertThat(report.getDirection()).isEqualTo(RoundTripReport.Direction.MODEL_TO_NOTATION_TO_MODEL);
        assertThat(report.isValid()).as(report.getDifferences().toString()).isTrue();
    }

    @Test
    void testModelRoundTripReportsLostEquipment() {
        PlantModel model = engine.toStructuredModel("a[tank]->b[tank]", false, null);
        IntermediateModel truncated = engine.fromStructuredModel(model);
        truncated.getUnits().removeIf(u -> u.getName().equals("b"));
        truncated.getStreams().clear();
        PlantModel rebuilt = engine.toStructuredModel(truncated, false, null);

        RoundTripReport.RoundTripReportBuilder builder = RoundTripReport.builder()
                .direction(RoundTripReport.Direction.MODEL_TO_NOTATION_TO_MODEL);
        ControlUnitClassifier classifier = new ControlUnitClassifier();
        PlantModelExtractor extractor = new PlantModelExtractor(
                ConverterContext.create(ConverterConfig.builder().build()).getRegistry(),
                new ConnectivityGraphProjector(), classifier);
        new RoundTripValidator(extractor, classifier).comparePlantModels(model, rebuilt, builder);

        assertThat(builder.build().getDifferences())
                .anySatisfy(d -> assertThat(d).startsWith("Equipment mismatch: missing [B]"))
                .anySatisfy(d -> assertThat(d).startsWith("Connection mismatch: missing [A->B]"));
    }

    @Test
    void testBlockExpandsThroughTemplate() {
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();
        IntermediateModel model = engine.parse("basin[biological_treatment](area=230,trains=2)->clar[clarifier]");

        PlantModel plant = engine.toStructuredModel(model, true, null, diagnostics);

        List<Equipment> equipment = plant.getConceptualModel().getEquipment();
        assertThat(equipment).hasSize(13);
        assertThat(equipment).extracting(Equipment::getTagName).contains("230-T-01", "230-T-02", "230-B-01", "CLAR");
        assertThat(plant.getConceptualModel().allSegments()).hasSize(9)
                .extracting(PipingNetworkSegment::getId)
                .contains("segment__230-T-01__CLAR", "segment__230-T-01__230-P-01");
        assertThat(diagnostics.getInfos()).anySatisfy(i -> assertThat(i).contains("template TK"));
    }

    @Test
    void testBlockWithoutExpansionIsSingleEquipment() {
        PlantModel plant = engine.toStructuredModel("basin[biological_treatment](area=230)->clar[clarifier]", false, null);

        assertThat(plant.getConceptualModel().getEquipment()).extracting(Equipment::getTagName)
                .containsExactly("BASIN", "CLAR");
    }

    @Test
    void testAbstractBlockUsesRegistryMapping() {
        PlantModel plant = engine.toStructuredModel("r-1[reactor]->s-1[separation_unit]", true, null);

        assertThat(plant.getConceptualModel().getEquipment()).extracting(Equipment::getComponentClass)
                .containsExactly("Reactor", "ProcessColumn");
    }

    @Test
    void testMetadataIsCarried() {
        PlantModel plant = engine.toStructuredModel("a[tank]", false, Map.of("revision", "B"));

        assertThat(plant.getMetadata()).containsEntry("revision", "B");
        assertThat(engine.fromStructuredModel(plant).getMetadata()).containsEntry("revision", "B");
    }

    @Test
    void testStreamKindFromProperty() {
        IntermediateModel model = engine.parse("a[tank]->b[tank]");
        Stream stream = model.getStreams().get(0);
        stream.getProperties().put("kind", ParameterValue.ofString("steam"));

        PlantModel plant = engine.toStructuredModel(model, false, null);

        assertThat(plant.getConceptualModel().allSegments().get(0).getPipes().get(0).getStreamKind()).isEqualTo("steam");
    }
}
