package com.plantmodel.flowsheet.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.conversion.ConversionDiagnostics;
import com.plantmodel.flowsheet.conversion.RoundTripReport;
import com.plantmodel.flowsheet.expansion.EquipmentInstance;
import com.plantmodel.flowsheet.expansion.ExpansionResult;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;

/**
 * Responsible only for printing command output. No validation, no execution.
 */
public class ConversionResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConversionResultsPrinter.class);

    public void printConversion(PlantModel model, String regenerated, ConversionDiagnostics diagnostics) {
        List<Equipment> equipment = model.getConceptualModel().getEquipment();
        List<ProcessInstrumentationFunction> functions = model.getConceptualModel().getInstrumentationFunctions();

        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Equipment: {}", equipment.size());
        for (Equipment item : equipment) {
            log.info("  {} ({}, {} nozzles)", item.getTagName(), item.getComponentClass(), item.getNozzles().size());
        }
        log.info("Piping Segments: {}", model.getConceptualModel().allSegments().size());
        log.info("Instrumentation Functions: {}", functions.size());
        for (ProcessInstrumentationFunction function : functions) {
            log.info("  {}", function.getTagName());
        }
        printDiagnostics(diagnostics);
        log.info("");
        log.info("Notation: {}", regenerated);
        log.info("=================================================");
    }

    public void printExpansion(ExpansionResult result) {
        log.info("=================================================");
        log.info("EXPANSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Block: {} -> {}", result.getSourceBlock(), result.getFlowsheetId());
        log.info("Equipment: {}", result.getEquipment().size());
        for (EquipmentInstance instance : result.getEquipment()) {
            log.info("  {} {} [{}]", instance.getTag(), instance.getComponentClass(), instance.getId());
        }
        log.info("Connections: {}", result.getConnections().size());
        log.info("Dropped Connections: {}", result.getMetadata().get("droppedConnections"));
        log.info("Components Used: {}", result.getMetadata().get("componentsUsed"));
        log.info("=================================================");
    }

    public void printRoundTrip(RoundTripReport report) {
        log.info("=================================================");
        log.info(report.isValid() ? "ROUND TRIP LOSSLESS" : "ROUND TRIP DIFFERENCES FOUND");
        log.info("=================================================");
        log.info("Regenerated: {}", report.getRegenerated());
        for (String difference : report.getDifferences()) {
            log.info("  {}", difference);
        }
        log.info("=================================================");
    }

    public void printErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  - {}", e));
    }

    private void printDiagnostics(ConversionDiagnostics diagnostics) {
        if (diagnostics.hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            diagnostics.getWarnings().forEach(w -> log.info("  {}", w));
        }
    }
}
