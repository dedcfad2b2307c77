package com.plantmodel.flowsheet.conversion;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;

/**
 * Compares the two ends of a round trip.
 *
 * Notation is compared by unit names and stream endpoint pairs, ignoring case. Plant
 * models are compared by equipment tags, connection tag pairs and the controller kind of
 * every instrumentation tag.
 */
public class RoundTripValidator {

    private final PlantModelExtractor extractor;
    private final ControlUnitClassifier classifier;

    public RoundTripValidator(PlantModelExtractor extractor, ControlUnitClassifier classifier) {
        this.extractor = extractor;
        this.classifier = classifier;
    }

    public void compareNotation(IntermediateModel before, IntermediateModel after, RoundTripReport.RoundTripReportBuilder report) {
        compare("Unit", unitNames(before), unitNames(after), report);
        compare("Stream", streamPairs(before), streamPairs(after), report);
    }

    public void comparePlantModels(PlantModel before, PlantModel after, RoundTripReport.RoundTripReportBuilder report) {
        compare("Equipment", equipmentTags(before), equipmentTags(after), report);
        compare("Connection", connectionPairs(before), connectionPairs(after), report);

        Map<String, String> kindsBefore = controllerKinds(before);
        Map<String, String> kindsAfter = controllerKinds(after);
        if (!kindsBefore.equals(kindsAfter)) {
            report.difference("Instrumentation mismatch: " + kindsBefore + " vs " + kindsAfter);
        }
    }

    private static void compare(String what, Set<String> before, Set<String> after,
                                RoundTripReport.RoundTripReportBuilder report) {
        if (before.equals(after)) {
            return;
        }
        Set<String> missing = new TreeSet<>(before);
        missing.removeAll(after);
        Set<String> added = new TreeSet<>(after);
        added.removeAll(before);
        report.difference(what + " mismatch: missing " + missing + ", added " + added);
    }

    private static Set<String> unitNames(IntermediateModel model) {
        return model.getUnits().stream()
                .map(Unit::getName)
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static Set<String> streamPairs(IntermediateModel model) {
        Set<String> pairs = new HashSet<>();
        for (Stream stream : model.getStreams()) {
            pairs.add(stream.getFromUnit().toLowerCase(Locale.ROOT) + "->" + stream.getToUnit().toLowerCase(Locale.ROOT));
        }
        return pairs;
    }

    private static Set<String> equipmentTags(PlantModel model) {
        return model.getConceptualModel().getEquipment().stream()
                .map(Equipment::getTagName)
                .collect(Collectors.toSet());
    }

    /** Equipment-to-equipment connections as upper-cased tag pairs; signal lines are not piping. */
    private Set<String> connectionPairs(PlantModel model) {
        IntermediateModel extracted = extractor.extract(model, new ConversionDiagnostics());
        Set<String> controllers = extracted.getUnits().stream()
                .filter(classifier::isControl)
                .map(Unit::getName)
                .collect(Collectors.toSet());
        Set<String> pairs = new HashSet<>();
        for (Stream stream : extracted.getStreams()) {
            if (controllers.contains(stream.getFromUnit()) || controllers.contains(stream.getToUnit())) {
                continue;
            }
            pairs.add(stream.getFromUnit().toUpperCase(Locale.ROOT) + "->" + stream.getToUnit().toUpperCase(Locale.ROOT));
        }
        return pairs;
    }

    private Map<String, String> controllerKinds(PlantModel model) {
        Map<String, String> kinds = new TreeMap<>();
        List<ProcessInstrumentationFunction> functions = model.getConceptualModel().getInstrumentationFunctions();
        for (ProcessInstrumentationFunction function : functions) {
            kinds.put(function.getTagName(), classifier.controllerKindOf(function));
        }
        return kinds;
    }
}
