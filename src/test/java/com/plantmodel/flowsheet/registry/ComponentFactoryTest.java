package com.plantmodel.flowsheet.registry;

import com.plantmodel.flowsheet.context.ConverterConfig;
import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.Nozzle;
import com.plantmodel.flowsheet.value.ParameterValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ComponentFactoryTest {

    private final ComponentFactory factory = new ComponentFactory(
            new ComponentRegistryLoader().loadFromClasspath("component-registry.yaml"),
            ConverterConfig.builder().build());

    @Test
    void testInstantiateWithDefaults() {
        Equipment pump = factory.instantiate("pump_centrifugal", "p-101", Map.of());

        assertThat(pump.getTagName()).isEqualTo("P-101");
        assertThat(pump.getComponentClass()).isEqualTo("CentrifugalPump");
        assertThat(pump.getNozzles()).extracting(Nozzle::getSubTagName).containsExactly("N1", "N2");
        assertThat(pump.getNozzles()).allSatisfy(n -> {
            assertThat(n.getNominalDiameter()).isEqualTo("DN50");
            assertThat(n.getNominalPressure()).isEqualTo("PN16");
        });
    }

    @Test
    void testOptionalAttributesCopied() {
        Equipment pump = factory.instantiate("pump", "P1", Map.of(
                "flowRate", ParameterValue.ofNumber(12.5),
                "colour", ParameterValue.ofString("blue")));

        assertThat(pump.getAttributes()).containsOnlyKeys("flowRate");
    }

    @Test
    void testNozzleCountOverride() {
        Equipment vessel = factory.instantiate("vessel", "V1", Map.of("nozzles", ParameterValue.coerce("5")));

        assertThat(vessel.getNozzles()).hasSize(5);
        assertThatThrownBy(() -> factory.instantiate("pump", "P1", Map.of("nozzles", ParameterValue.ofNumber(9))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("outside");
    }

    @Test
    void testCustomEquipmentTypeName() {
        Equipment custom = factory.instantiate("custom", "X1", Map.of());
        Equipment named = factory.instantiate("custom", "X2", Map.of("typeName", ParameterValue.ofString("DiffuserGrid")));

        assertThat(custom.getTypeName()).isEqualTo("Custom Equipment");
        assertThat(named.getTypeName()).isEqualTo("DiffuserGrid");
    }

    @Test
    void testBlankTagRejected() {
        assertThatThrownBy(() -> factory.instantiate("tank", " ", Map.of()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testAbstractBlockInstantiation() {
        Unit block = Unit.builder().name("r-1").type("reaction").build();

        List<Equipment> created = factory.instantiateFromAbstractBlock(block);

        assertThat(created).singleElement()
                .satisfies(e -> {
                    assertThat(e.getComponentClass()).isEqualTo("Reactor");
                    assertThat(e.getTagName()).isEqualTo("R-1");
                });
    }

    @Test
    void testAddNozzleNumbersSequentially() {
        Equipment tank = factory.instantiate("tank", "T1", Map.of());

        Nozzle added = factory.addNozzle(tank);

        assertThat(added.getId()).isEqualTo("T1-N3");
        assertThat(tank.getNozzles()).hasSize(3);
    }
}
