package com.plantmodel.flowsheet.expansion;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.exception.UnknownComponentTypeException;
import com.plantmodel.flowsheet.registry.ComponentFactory;
import com.plantmodel.flowsheet.registry.ComponentRegistry;
import com.plantmodel.flowsheet.registry.ComponentRegistryLoader;
import com.plantmodel.flowsheet.template.ClasspathTemplateSource;
import com.plantmodel.flowsheet.template.DirectoryTemplateSource;
import com.plantmodel.flowsheet.template.TemplateResolver;
import com.plantmodel.flowsheet.value.ParameterValue;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for train expansion, condition gating and connection wiring.
 */
class ExpansionEngineTest {

    private static ComponentRegistry registry;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadRegistry() {
        registry = new ComponentRegistryLoader().loadFromClasspath("component-registry.yaml");
    }

    @Test
    void testPerTrainTagsForFourTrains() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - id: Basin
                    tag_prefix: T
                    class: Tank
                """);

        ExpansionResult result = engine().expand("basin", "TK", 230, 4, Map.of());

        assertThat(result.tags()).containsExactly("230-T-01", "230-T-02", "230-T-03", "230-T-04");
        assertThat(result.getEquipment()).extracting(EquipmentInstance::getTrainNumber).containsExactly(1, 2, 3, 4);
        assertThat(result.getFlowsheetId()).isEqualTo("PFD_230");
    }

    @Test
    void testEveryTrainPatternPairsTrainByTrain() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, tag_prefix: T, class: Tank}
                  - {id: Pump, tag_prefix: P, component: pump}
                connections: |
                  Basin-*.outlet -> Pump-*.inlet
                """);

        ExpansionResult result = engine().expand("basin", "TK", null, 3, Map.of());

        assertThat(result.getConnections()).hasSize(3)
                .extracting(c -> c.getFromEquipment() + ">" + c.getToEquipment())
                .containsExactly("Basin-1>Pump-1", "Basin-2>Pump-2", "Basin-3>Pump-3");
        assertThat(result.getConnections()).allSatisfy(c -> {
            assertThat(c.getFromPort()).isEqualTo("outlet");
            assertThat(c.getToPort()).isEqualTo("inlet");
        });
    }

    @Test
    void testNextTrainChainsAndLastTrain() throws IOException {
        template("""
                area_number: 100
                per_train_equipment:
                  - {id: Basin, class: Tank}
                shared_equipment:
                  - {id: Clarifier, component: clarifier, tag_prefix: CL}
                connections: |
                  Basin-*.outlet -> Basin-(*+1).inlet
                  Basin-N.outlet -> Clarifier.inlet
                """);

        ExpansionResult result = engine().expand("b", "TK", null, 3, Map.of());

        assertThat(result.getConnections())
                .extracting(c -> c.getFromEquipment() + ">" + c.getToEquipment())
                .containsExactly("Basin-1>Basin-2", "Basin-2>Basin-3", "Basin-3>Clarifier");
        assertThat(result.findInstance("Clarifier")).hasValueSatisfying(i -> {
            assertThat(i.isShared()).isTrue();
            assertThat(i.getTag()).isEqualTo("100-CL-01");
        });
    }

    @Test
    void testCountAboveOneNumbersWithinTrain() throws IOException {
        template("""
                area_number: 210
                per_train_equipment:
                  - {id: Screen, tag_prefix: SC, component: screen, count: 2}
                shared_equipment:
                  - {id: Blower, tag_prefix: B, class: CentrifugalBlower, count: 2}
                """);

        ExpansionResult result = engine().expand("pt", "TK", null, 2, Map.of());

        assertThat(result.tags()).containsExactly(
                "210-SC-01.01", "210-SC-01.02", "210-SC-02.01", "210-SC-02.02", "210-B-01", "210-B-02");
        assertThat(result.instancesById()).containsKeys("Screen-1-1", "Screen-2-2", "Blower-1", "Blower-2");
    }

    @Test
    void testUnknownEndpointIsDropped() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, class: Tank}
                connections: |
                  Basin-*.outlet -> Ghost-*.inlet
                """);

        ExpansionResult result = engine().expand("b", "TK", null, 2, Map.of());

        assertThat(result.getConnections()).isEmpty();
        assertThat(result.getMetadata()).containsEntry("droppedConnections", 2);
    }

    @Test
    void testBoundaryConnectionsKept() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, class: Tank}
                connections: |
                  BFD.inlet -> Basin-*.inlet
                """);

        ExpansionResult result = engine().expand("b", "TK", null, 2, Map.of());

        assertThat(result.getConnections()).hasSize(2).allSatisfy(c -> {
            assertThat(c.touchesBoundary()).isTrue();
            assertThat(c.getMetadata()).containsEntry("portMapping", "BFD.inlet -> Basin-*.inlet");
        });
    }

    @Test
    void testPlaceholdersInConnectionLines() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, tag_prefix: T, class: Tank}
                  - {id: Pump, tag_prefix: P, component: pump}
                  - {id: Lift, tag_prefix: LP, component: pump}
                connections: |
                  Basin-*.outlet -> ${target|Pump}-*.inlet
                """);

        ExpansionResult defaults = engine().expand("b", "TK", null, 3, Map.of());
        ExpansionResult overridden = engine().expand("b", "TK", null, 3,
                Map.of("target", ParameterValue.ofString("Lift")));

        assertThat(defaults.getConnections())
                .extracting(c -> c.getFromEquipment() + ">" + c.getToEquipment())
                .containsExactly("Basin-1>Pump-1", "Basin-2>Pump-2", "Basin-3>Pump-3");
        assertThat(overridden.getConnections())
                .extracting(ConnectionInstance::getToEquipment)
                .containsExactly("Lift-1", "Lift-2", "Lift-3");
    }

    @Test
    void testUnresolvedConnectionPlaceholderFailsAtExpansion() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, class: Tank}
                connections: |
                  Basin-*.outlet -> ${target}-*.inlet
                """);
        ExpansionEngine engine = engine();

        assertThatThrownBy(() -> engine.expand("b", "TK", null, 2, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("target");
    }

    @Test
    void testNextTrainSourceToBoundary() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, class: Tank}
                connections: |
                  Basin-(*+1).outlet -> BFD.outlet
                """);

        ExpansionResult result = engine().expand("b", "TK", null, 3, Map.of());

        assertThat(result.getConnections()).hasSize(2)
                .extracting(ConnectionInstance::getFromEquipment)
                .containsExactly("Basin-2", "Basin-3");
        assertThat(result.getConnections()).allSatisfy(c -> assertThat(c.touchesBoundary()).isTrue());
    }

    @Test
    void testIdContainingMarkerIsNotBoundary() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: SubBFD, class: Tank}
                  - {id: Pump, tag_prefix: P, component: pump}
                connections: |
                  SubBFD-*.outlet -> Pump-*.inlet
                """);

        ExpansionResult result = engine().expand("b", "TK", null, 2, Map.of());

        assertThat(result.getConnections()).hasSize(2).allSatisfy(c -> {
            assertThat(c.touchesBoundary()).isFalse();
            assertThat(c.getMetadata()).doesNotContainKey("portMapping");
        });
        assertThat(result.getConnections()).extracting(ConnectionInstance::getFromEquipment)
                .containsExactly("SubBFD-1", "SubBFD-2");
    }

    @Test
    void testPlaceholdersAndCustomEquipment() throws IOException {
        template("""
                area_number: 230
                parameters:
                  prefix: {default: DG}
                per_train_equipment:
                  - id: Diffuser
                    tag_prefix: "${prefix}"
                    default_params:
                      depth: "${depth|4.5}"
                """);

        ExpansionResult result = engine().expand("b", "TK", null, 1, Map.of());

        EquipmentInstance diffuser = result.getEquipment().get(0);
        assertThat(diffuser.getTag()).isEqualTo("230-DG-01");
        assertThat(diffuser.getComponentClass()).isEqualTo("CustomEquipment");
        assertThat(diffuser.getEquipment().getTypeName()).isEqualTo("Diffuser");
        assertThat(diffuser.getParameters().get("depth").kind()).isEqualTo(ParameterValue.Kind.NUMBER);
    }

    @Test
    void testDuplicateKeysRejected() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Basin, class: Tank}
                  - {id: Basin, tag_prefix: X, class: Tank}
                """);

        assertThatThrownBy(() -> engine().expand("b", "TK", null, 1, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Basin-1");
    }

    @Test
    void testUnknownClassRejected() throws IOException {
        template("""
                area_number: 230
                per_train_equipment:
                  - {id: Thing, class: NoSuchClass}
                """);

        assertThatThrownBy(() -> engine().expand("b", "TK", null, 1, Map.of()))
                .isInstanceOf(UnknownComponentTypeException.class)
                .hasMessageContaining("NoSuchClass");
    }

    @Test
    void testAreaAndTrainCountChecks() throws IOException {
        template("""
                per_train_equipment:
                  - {id: Basin, class: Tank}
                """);
        ExpansionEngine engine = engine();

        assertThatThrownBy(() -> engine.expand("b", "TK", null, 1, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("area");
        assertThatThrownBy(() -> engine.expand("b", "TK", 230, 0, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Train count");
    }

    @Test
    void testBundledTemplateDefaults() {
        ExpansionResult result = bundledEngine().expand("aeration", "TK", null, 2, Map.of());

        assertThat(result.getEquipment()).hasSize(12);
        assertThat(result.getConnections()).hasSize(12);
        assertThat(result.tags()).contains("230-T-01", "230-P-02", "230-AIT-01", "230-DG-02", "230-RP-01", "230-B-02")
                .doesNotContain("230-M-01");
        assertThat(result.getMetadata())
                .containsEntry("areaNumber", 230)
                .containsEntry("trainCount", 2)
                .containsEntry("droppedConnections", 0)
                .containsEntry("componentsUsed", List.of("aeration_system", "recycle_loop", "mechanical_drive"));
        assertThat(result.findInstance("Basin-1")).hasValueSatisfying(basin ->
                assertThat(basin.getEquipment().getAttributes().get("volume").asText()).isEqualTo("1500"));
    }

    @Test
    void testConditionsFollowRuntimeParameters() {
        ExpansionResult result = bundledEngine().expand("aeration", "TK", null, 1, Map.of(
                "aeration_type", ParameterValue.ofString("mechanical"),
                "do_control", ParameterValue.ofBoolean(false),
                "basin_volume", ParameterValue.ofNumber(2500)));

        assertThat(result.tags()).contains("230-M-01", "230-GB-01")
                .doesNotContain("230-B-01", "230-DG-01", "230-AIT-01");
        assertThat(result.getMetadata().get("excludedEquipment"))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .contains("Blower", "Diffuser", "DO_Analyzer");
        assertThat(result.findInstance("Basin-1")).hasValueSatisfying(basin ->
                assertThat(basin.getEquipment().getAttributes().get("volume").asText()).isEqualTo("2500"));
    }

    @Test
    void testRuntimeParametersValidated() {
        ExpansionEngine engine = bundledEngine();

        assertThatThrownBy(() -> engine.expand("a", "TK", null, 1, Map.of("basin_volume", ParameterValue.ofNumber(10))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("minimum");
        assertThatThrownBy(() -> engine.expand("a", "TK", null, 1, Map.of("aeration_type", ParameterValue.ofString("jet"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("jet");
    }

    private ExpansionEngine engine() {
        return new ExpansionEngine(new TemplateResolver(new DirectoryTemplateSource(tempDir)), factory());
    }

    private static ExpansionEngine bundledEngine() {
        return new ExpansionEngine(new TemplateResolver(new ClasspathTemplateSource("process-templates")), factory());
    }

    private static ComponentFactory factory() {
        return new ComponentFactory(registry, ConverterConfig.builder().build());
    }

    private void template(String content) throws IOException {
        Files.writeString(tempDir.resolve("registry.yaml"), "templates:\n  TK: tk.yaml\n");
        Files.writeString(tempDir.resolve("tk.yaml"), content);
    }
}
