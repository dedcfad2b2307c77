package com.plantmodel.flowsheet.conversion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.exception.InvalidStreamReferenceException;
import com.plantmodel.flowsheet.expansion.ConnectionInstance;
import com.plantmodel.flowsheet.expansion.EquipmentInstance;
import com.plantmodel.flowsheet.expansion.ExpansionEngine;
import com.plantmodel.flowsheet.expansion.ExpansionResult;
import com.plantmodel.flowsheet.notation.NotationParser;
import com.plantmodel.flowsheet.notation.NotationVersion;
import com.plantmodel.flowsheet.notation.NotationWriter;
import com.plantmodel.flowsheet.notation.model.IntermediateModel;
import com.plantmodel.flowsheet.notation.model.ModelKind;
import com.plantmodel.flowsheet.notation.model.Stream;
import com.plantmodel.flowsheet.notation.model.Unit;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.plant.PlantModel;
import com.plantmodel.flowsheet.plant.ProcessInstrumentationFunction;
import com.plantmodel.flowsheet.registry.ComponentDefinition;
import com.plantmodel.flowsheet.registry.ComponentFactory;
import com.plantmodel.flowsheet.registry.ComponentRegistry;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Converts between notation and plant models in both directions.
 *
 * <p>Notation to plant model: parse, split controller units from equipment, instantiate the
 * equipment (expanding blocks when asked), pipe every equipment-to-equipment stream and
 * finally attach an instrumentation function per controller.
 *
 * <p>Plant model to notation: extract units and streams, then write them.
 */
public class ConversionEngine {
    private static final Logger log = LoggerFactory.getLogger(ConversionEngine.class);

    /** Unit parameters steering block expansion; they are not passed to the template. */
    public static final String AREA_PARAMETER = "area";
    public static final String TRAINS_PARAMETER = "trains";

    private final NotationParser parser;
    private final NotationWriter writer;
    private final ComponentFactory factory;
    private final ExpansionEngine expansionEngine;
    private final ControlUnitClassifier classifier;
    private final ConnectionBuilder connectionBuilder;
    private final InstrumentationBuilder instrumentationBuilder;
    private final PlantModelExtractor extractor;
    private final RoundTripValidator roundTripValidator;

    public ConversionEngine(NotationParser parser,
                            NotationWriter writer,
                            ComponentFactory factory,
                            ExpansionEngine expansionEngine,
                            ConnectionBuilder connectionBuilder,
                            PlantModelExtractor extractor,
                            ControlUnitClassifier classifier) {
        this.parser = parser;
        this.writer = writer;
        this.factory = factory;
        this.expansionEngine = expansionEngine;
        this.connectionBuilder = connectionBuilder;
        this.extractor = extractor;
        this.classifier = classifier;
        this.instrumentationBuilder = new InstrumentationBuilder(classifier);
        this.roundTripValidator = new RoundTripValidator(extractor, classifier);
    }

    public IntermediateModel parse(String text) {
        return parser.parse(text);
    }

    public ComponentDefinition resolveType(String key) {
        return factory.getRegistry().resolve(key);
    }

    public PlantModel toStructuredModel(String text, boolean expandAbstractBlocks, Map<String, Object> metadata) {
        return toStructuredModel(parse(text), expandAbstractBlocks, metadata, new ConversionDiagnostics());
    }

    public PlantModel toStructuredModel(IntermediateModel model, boolean expandAbstractBlocks,
                                        Map<String, Object> metadata) {
        return toStructuredModel(model, expandAbstractBlocks, metadata, new ConversionDiagnostics());
    }

    /**
     * @throws InvalidStreamReferenceException when a stream names a unit that does not exist
     */
    public PlantModel toStructuredModel(IntermediateModel model, boolean expandAbstractBlocks,
                                        Map<String, Object> metadata, ConversionDiagnostics diagnostics) {
        Map<String, Object> modelMetadata = new LinkedHashMap<>(model.getMetadata());
        if (metadata != null) {
            modelMetadata.putAll(metadata);
        }
        PlantModel plant = PlantModel.builder().metadata(modelMetadata).build();

        // Step 1: controllers vs equipment
        List<Unit> controllers = new ArrayList<>();
        List<Unit> ordinary = new ArrayList<>();
        for (Unit unit : model.getUnits()) {
            if (classifier.isControl(unit)) {
                controllers.add(unit);
            } else {
                ordinary.add(unit);
            }
        }
        Set<String> controllerNames = new LinkedHashSet<>();
        controllers.forEach(u -> controllerNames.add(u.getName()));
        log.info("Step 1: {} equipment units, {} controllers", ordinary.size(), controllers.size());

        // Step 2: equipment
        boolean expand = expandAbstractBlocks && model.getKind() == ModelKind.BLOCK;
        Map<String, Equipment> primaryByUnit = new LinkedHashMap<>();
        for (Unit unit : ordinary) {
            if (expand) {
                primaryByUnit.put(unit.getName(), instantiateBlock(unit, plant, diagnostics).get(0));
            } else {
                Equipment equipment = instantiate(unit);
                plant.getConceptualModel().addEquipment(equipment);
                primaryByUnit.put(unit.getName(), equipment);
            }
        }
        log.info("Step 2: created {} equipment items", plant.getConceptualModel().getEquipment().size());

        // Step 3: piping
        int piped = 0;
        for (Stream stream : model.getStreams()) {
            if (controllerNames.contains(stream.getFromUnit()) || controllerNames.contains(stream.getToUnit())) {
                continue;
            }
            Equipment from = endpoint(stream.getFromUnit(), "source", primaryByUnit, model);
            Equipment to = endpoint(stream.getToUnit(), "target", primaryByUnit, model);
            connectionBuilder.connect(plant, from, to, streamKind(stream), stream.getTags(), diagnostics);
            piped++;
        }
        log.info("Step 3: piped {} streams", piped);

        // Step 4: instrumentation
        for (Unit controller : controllers) {
            Equipment sensed = model.getStreams().stream()
                    .filter(s -> s.getToUnit().equals(controller.getName()))
                    .map(s -> primaryByUnit.get(s.getFromUnit()))
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
            if (sensed == null) {
                diagnostics.info("Controller " + controller.getName() + " has no measured equipment");
            }
            ProcessInstrumentationFunction function = instrumentationBuilder.build(
                    controller.getName(), classifier.controllerKind(controller), sensed);
            plant.getConceptualModel().addInstrumentationFunction(function);
        }
        log.info("Step 4: created {} instrumentation functions", controllers.size());
        return plant;
    }

    public IntermediateModel fromStructuredModel(PlantModel model) {
        return fromStructuredModel(model, new ConversionDiagnostics());
    }

    public IntermediateModel fromStructuredModel(PlantModel model, ConversionDiagnostics diagnostics) {
        return extractor.extract(model, diagnostics);
    }

    public String notationOf(PlantModel model, boolean canonical, NotationVersion version) {
        return writer.write(fromStructuredModel(model), canonical, version);
    }

    public String notationOf(IntermediateModel model, boolean canonical, NotationVersion version) {
        return writer.write(model, canonical, version);
    }

    /**
     * Notation to plant model and back. Blocks are not expanded so the unit set stays
     * comparable.
     */
    public RoundTripReport roundTripCheck(String notation) {
        IntermediateModel before = parse(notation);
        PlantModel plant = toStructuredModel(before, false, null);
        String regenerated = notationOf(plant, true, NotationVersion.V2);
        IntermediateModel after = parse(regenerated);

        RoundTripReport.RoundTripReportBuilder report = RoundTripReport.builder()
                .direction(RoundTripReport.Direction.NOTATION_TO_MODEL_TO_NOTATION)
                .regenerated(regenerated);
        roundTripValidator.compareNotation(before, after, report);
        return logged(report.build());
    }

    /**
     * Plant model to notation and back.
     */
    public RoundTripReport roundTripCheck(PlantModel original) {
        String regenerated = notationOf(original, true, NotationVersion.V2);
        PlantModel rebuilt = toStructuredModel(parse(regenerated), false, original.getMetadata());

        RoundTripReport.RoundTripReportBuilder report = RoundTripReport.builder()
                .direction(RoundTripReport.Direction.MODEL_TO_NOTATION_TO_MODEL)
                .regenerated(regenerated);
        roundTripValidator.comparePlantModels(original, rebuilt, report);
        return logged(report.build());
    }

    private static RoundTripReport logged(RoundTripReport report) {
        if (report.isValid()) {
            log.info("Round trip {} is lossless", report.getDirection());
        } else {
            log.info("Round trip {} found {} differences", report.getDirection(), report.getDifferences().size());
        }
        return report;
    }

    private Equipment instantiate(Unit unit) {
        return factory.instantiate(unit.getType(), unit.getName(), unit.getParameters());
    }

    /**
     * Template expansion when the unit names a template (or its type carries one), the
     * registry's block mapping otherwise, direct instantiation as the last resort. Every
     * created object is attached; the first is the unit's primary equipment.
     */
    private List<Equipment> instantiateBlock(Unit unit, PlantModel plant, ConversionDiagnostics diagnostics) {
        List<Equipment> created = new ArrayList<>();
        Optional<String> template = templateFor(unit);
        if (template.isPresent()) {
            created.addAll(expandBlock(unit, template.get(), plant, diagnostics));
        } else if (factory.getRegistry().isAbstractBlock(unit.getType())) {
            created.addAll(factory.instantiateFromAbstractBlock(unit));
            created.forEach(plant.getConceptualModel()::addEquipment);
        }
        if (created.isEmpty()) {
            Equipment equipment = instantiate(unit);
            plant.getConceptualModel().addEquipment(equipment);
            created.add(equipment);
        }
        return created;
    }

    private Optional<String> templateFor(Unit unit) {
        ParameterValue explicit = unit.getParameter(NotationParser.TEMPLATE_PARAMETER);
        if (explicit != null && !explicit.asText().isBlank()) {
            return Optional.of(explicit.asText().trim());
        }
        Integer area = intParameter(unit, AREA_PARAMETER, null);
        return factory.getRegistry().find(unit.getType())
                .flatMap(ComponentDefinition::getExpansionTemplateId)
                .filter(id -> expansionEngine.getResolver().hasTemplate(id, area));
    }

    private List<Equipment> expandBlock(Unit unit, String templateId, PlantModel plant,
                                        ConversionDiagnostics diagnostics) {
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        factory.getRegistry().find(unit.getType()).ifPresent(d -> params.putAll(d.getExpansionParameters()));
        unit.getParameters().forEach((key, value) -> {
            if (!NotationParser.TEMPLATE_PARAMETER.equals(key) && !AREA_PARAMETER.equals(key)
                    && !TRAINS_PARAMETER.equals(key)) {
                params.put(key, value);
            }
        });

        ExpansionResult result = expansionEngine.expand(unit.getName(), templateId,
                intParameter(unit, AREA_PARAMETER, null), intParameter(unit, TRAINS_PARAMETER, 1), params);

        List<Equipment> created = new ArrayList<>();
        for (EquipmentInstance instance : result.getEquipment()) {
            plant.getConceptualModel().addEquipment(instance.getEquipment());
            created.add(instance.getEquipment());
        }

        Map<String, EquipmentInstance> byId = result.instancesById();
        for (ConnectionInstance connection : result.getConnections()) {
            if (connection.touchesBoundary()) {
                continue;
            }
            connectionBuilder.connect(plant,
                    byId.get(connection.getFromEquipment()).getEquipment(),
                    byId.get(connection.getToEquipment()).getEquipment(),
                    connection.getStreamKind(), Map.of(), diagnostics);
        }
        diagnostics.info("Block " + unit.getName() + " expanded with template " + templateId + " into "
                + created.size() + " equipment items");
        return created;
    }

    private static Integer intParameter(Unit unit, String name, Integer defaultValue) {
        ParameterValue value = unit.getParameter(name);
        if (value == null) {
            return defaultValue;
        }
        ParameterValue number = value.kind() == ParameterValue.Kind.NUMBER ? value : ParameterValue.coerce(value.asText());
        if (number.kind() != ParameterValue.Kind.NUMBER) {
            throw new ConfigurationException("Parameter '" + name + "' of unit '" + unit.getName()
                    + "' must be a number, got '" + value.asText() + "'");
        }
        return ((ParameterValue.NumberValue) number).getValue().intValue();
    }

    private static Equipment endpoint(String unitName, String role, Map<String, Equipment> primaryByUnit,
                                      IntermediateModel model) {
        Equipment equipment = primaryByUnit.get(unitName);
        if (equipment == null) {
            throw new InvalidStreamReferenceException(unitName, role, model.unitNames());
        }
        return equipment;
    }

    private static String streamKind(Stream stream) {
        ParameterValue kind = stream.getProperties().get("kind");
        return kind != null ? kind.asText() : "material";
    }
}
