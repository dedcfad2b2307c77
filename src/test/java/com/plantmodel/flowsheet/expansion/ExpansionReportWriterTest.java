package com.plantmodel.flowsheet.expansion;

import com.plantmodel.flowsheet.plant.Equipment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ExpansionReportWriterTest {

    @TempDir
    Path tempDir;

    private final ExpansionReportWriter writer = new ExpansionReportWriter();

    @Test
    void testRenderListsEquipmentAndConnections() {
        String report = writer.render(sampleResult());

        assertThat(report).contains("Expansion report: basin -> PFD_230");
        assertThat(report).contains("230-T-01", "CentrifugalPump", "train=1");
        assertThat(report).contains("BFD.inlet -> Basin-1.inlet [material] (boundary)");
        assertThat(report).contains("trainCount: 1");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("reports/nested/expansion.txt");

        writer.write(sampleResult(), file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("Connections (2)");
    }

    private static ExpansionResult sampleResult() {
        Equipment tank = Equipment.builder().id("230-T-01").tagName("230-T-01").componentClass("Tank").build();
        Equipment pump = Equipment.builder().id("230-P-01").tagName("230-P-01").componentClass("CentrifugalPump").build();
        return ExpansionResult.builder()
                .flowsheetId("PFD_230")
                .sourceBlock("basin")
                .equipmentItem(EquipmentInstance.builder()
                        .id("Basin-1").tag("230-T-01").componentClass("Tank").equipment(tank).trainNumber(1).build())
                .equipmentItem(EquipmentInstance.builder()
                        .id("Pump-1").tag("230-P-01").componentClass("CentrifugalPump").equipment(pump).trainNumber(1).build())
                .connection(ConnectionInstance.builder()
                        .fromEquipment("BFD").fromPort("inlet").toEquipment("Basin-1").toPort("inlet")
                        .streamKind("material").build())
                .connection(ConnectionInstance.builder()
                        .fromEquipment("Basin-1").fromPort("outlet").toEquipment("Pump-1").toPort("inlet")
                        .streamKind("material").build())
                .metadataEntry("trainCount", 1)
                .build();
    }
}
