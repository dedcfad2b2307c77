package com.plantmodel.flowsheet.conversion;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.context.ConverterContext;
import com.plantmodel.flowsheet.graph.ConnectivityGraphProjector;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.plant.CustomStringAttribute;
import com.plantmodel.flowsheet.plant.PipingNetworkSegment;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.registry.ComponentRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class PlantModelExtractorTest {

    private static ConverterContext context;

    @BeforeAll
    static void createContext() {
        context = ConverterContext.create(ConverterConfig.builder().build());
    }

    @Test
    void testEndpointsFromSegmentId() {
        Map<String, String> units = Map.of("P-1", "p-1", "T-2", "t-2");

        assertThat(PlantModelExtractor.endpointsFromId("segment__P-1__T-2", units))
                .hasValueSatisfying(e -> assertThat(e).containsExactly("p-1", "t-2"));
        assertThat(PlantModelExtractor.endpointsFromId("segment__P-1__T-2__3", units)).isPresent();
        assertThat(PlantModelExtractor.endpointsFromId("segment__P-1__X-9", units)).isEmpty();
        assertThat(PlantModelExtractor.endpointsFromId("pipe_7", units)).isEmpty();
        assertThat(PlantModelExtractor.endpointsFromId(null, units)).isEmpty();
    }

    @Test
    void testProjectionFailureFallsBackToSegmentIds() {
        PlantModel plant = context.getConversionEngine()
                .toStructuredModel("a[tank]->b[pump]->c[tank]", false, null);
        PlantModelExtractor extractor = new PlantModelExtractor(context.getRegistry(), model -> {
            throw new IllegalStateException("graph backend unavailable");
        }, new ControlUnitClassifier());
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();

        IntermediateModel extracted = extractor.extract(plant, diagnostics);

        assertThat(extracted.getStreams()).extracting(s -> s.getFromUnit() + "->" + s.getToUnit())
                .containsExactlyInAnyOrder("a->b", "b->c");
        assertThat(diagnostics.getWarnings()).singleElement()
                .satisfies(w -> assertThat(w).contains("graph backend unavailable"));
    }

    @Test
    void testUnlinkedSegmentReadFromId() {
        PlantModel plant = context.getConversionEngine().toStructuredModel("a[tank] b[tank]", false, null);
        plant.getConceptualModel().pipingSystem("main_piping_system").getSegments().add(
                PipingNetworkSegment.builder().id("segment__A__B").build());

        IntermediateModel extracted = extractor().extract(plant, new ConversionDiagnostics());

        assertThat(extracted.getStreams()).singleElement().satisfies(s -> {
            assertThat(s.getFromUnit()).isEqualTo("a");
            assertThat(s.getToUnit()).isEqualTo("b");
        });
    }

    @Test
    void testUnreadableSegmentIsReported() {
        PlantModel plant = context.getConversionEngine().toStructuredModel("a[tank]", false, null);
        plant.getConceptualModel().pipingSystem("main_piping_system").getSegments().add(
                PipingNetworkSegment.builder().id("line-42").build());
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();

        IntermediateModel extracted = extractor().extract(plant, diagnostics);

        assertThat(extracted.getStreams()).isEmpty();
        assertThat(diagnostics.getWarnings()).anySatisfy(w -> assertThat(w).contains("line-42"));
    }

    @Test
    void testTagsReadFromSegmentAttributes() {
        PlantModel plant = context.getConversionEngine().toStructuredModel("a[tank]->b[tank]", false, null);
        plant.getConceptualModel().allSegments().get(0).getCustomAttributes()
                .add(new CustomStringAttribute("tag:line", "L1,L2"));

        Stream stream = extractor().extract(plant, new ConversionDiagnostics()).getStreams().get(0);

        assertThat(stream.getTags()).containsEntry("line", List.of("L1", "L2"));
        assertThat(stream.getProperties()).doesNotContainKey("segment");
    }

    @Test
    void testUnknownClassFallsBackToSnakeCaseType() {
        PlantModel plant = context.getConversionEngine().toStructuredModel("a[tank]", false, null);
        plant.getConceptualModel().getEquipment().get(0).setComponentClass("PlateSettler");

        assertThat(extractor().extract(plant, new ConversionDiagnostics()).findUnit("a"))
                .map(u -> u.getType())
                .isEqualTo(Optional.of("plate_settler"));
    }

    @Test
    void testUnitNamesAreLowerCase() {
        assertThat(PlantModelExtractor.unitName("230-T-01")).isEqualTo("230-t-01");
    }

    private static PlantModelExtractor extractor() {
        ComponentRegistry registry = context.getRegistry();
        return new PlantModelExtractor(registry, new ConnectivityGraphProjector(), new ControlUnitClassifier());
    }
}
