package com.plantmodel.flowsheet.expansion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.exception.UnknownComponentTypeException;
import com.plantmodel.flowsheet.plant.Equipment;
import com.plantmodel.flowsheet.registry.ComponentDefinition;
import com.plantmodel.flowsheet.registry.ComponentFactory;
import com.plantmodel.flowsheet.registry.ComponentRegistry;
import com.plantmodel.flowsheet.template.ConnectionDslParser;
import com.plantmodel.flowsheet.template.ConnectionSpec;
import com.plantmodel.flowsheet.template.EquipmentSpec;
import com.plantmodel.flowsheet.template.ParameterSpec;
import com.plantmodel.flowsheet.template.PlaceholderSubstitution;
import com.plantmodel.flowsheet.template.ProcessTemplate;
import com.plantmodel.flowsheet.template.TemplateResolver;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Expands an abstract block into concrete equipment trains.
 *
 * Per-train specs are instantiated once per train and instance:
 * <pre>
 *   count = 1   {area}-{prefix}-{train:02}          key {id}-{train}
 *   count > 1   {area}-{prefix}-{train:02}.{i:02}   key {id}-{train}-{i}
 * </pre>
 * Shared specs get {@code {area}-{prefix}-{i:02}} with key {@code {id}} or {@code {id}-{i}}.
 * Connection endpoints that name no instance are dropped and counted in the metadata.
 */
public class ExpansionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExpansionEngine.class);

    static final String CUSTOM_COMPONENT = "custom";

    private final TemplateResolver resolver;
    private final ComponentFactory factory;
    private final ConditionParser conditionParser = new ConditionParser();
    private final EndpointPatternExpander patternExpander = new EndpointPatternExpander();

    public ExpansionEngine(TemplateResolver resolver, ComponentFactory factory) {
        this.resolver = resolver;
        this.factory = factory;
    }

    public TemplateResolver getResolver() {
        return resolver;
    }

    /**
     * @param blockId     block being expanded, recorded in the result
     * @param processId   template id, e.g. {@code TK}
     * @param areaNumber  area for tags; the template's own area when null
     * @param trainCount  number of parallel trains, at least 1
     * @param params      runtime parameter values; may add names the template does not declare
     */
    public ExpansionResult expand(String blockId, String processId, Integer areaNumber, int trainCount,
                                  Map<String, ParameterValue> params) {
        ProcessTemplate template = resolver.load(processId, areaNumber);
        Integer area = areaNumber != null ? areaNumber : template.getAreaNumber();
        if (area == null) {
            throw new ConfigurationException("No area number given for '" + processId
                    + "' and the template declares none");
        }
        if (trainCount < 1) {
            throw new ConfigurationException("Train count must be at least 1, got " + trainCount);
        }

        Map<String, ParameterValue> effective = effectiveParameters(template, params == null ? Map.of() : params);
        log.info("Expanding block '{}' with template '{}' (area {}, {} trains)", blockId, processId, area, trainCount);

        Map<String, EquipmentInstance> instances = new LinkedHashMap<>();
        List<String> excluded = new ArrayList<>();

        for (int train = 1; train <= trainCount; train++) {
            for (EquipmentSpec spec : template.getPerTrainEquipment()) {
                if (!included(spec, effective, excluded, train == 1)) {
                    continue;
                }
                EquipmentSpec resolved = substitute(spec, effective);
                for (int i = 1; i <= resolved.getCount(); i++) {
                    String tag = resolved.getCount() > 1
                            ? String.format("%d-%s-%02d.%02d", area, resolved.getTagPrefix(), train, i)
                            : String.format("%d-%s-%02d", area, resolved.getTagPrefix(), train);
                    String key = resolved.getCount() > 1
                            ? resolved.localKey() + "-" + train + "-" + i
                            : resolved.localKey() + "-" + train;
                    register(instances, key, instantiate(resolved, key, tag, train, area));
                }
            }
        }

        for (EquipmentSpec spec : template.getSharedEquipment()) {
            if (!included(spec, effective, excluded, true)) {
                continue;
            }
            EquipmentSpec resolved = substitute(spec, effective);
            for (int i = 1; i <= resolved.getCount(); i++) {
                String tag = String.format("%d-%s-%02d", area, resolved.getTagPrefix(), i);
                String key = resolved.getCount() > 1 ? resolved.localKey() + "-" + i : resolved.localKey();
                register(instances, key, instantiate(resolved, key, tag, null, area));
            }
        }

        List<String> dropped = new ArrayList<>();
        List<ConnectionSpec> resolvedConnections = template.getConnections().stream()
                .map(spec -> substitute(spec, effective))
                .toList();
        List<ConnectionInstance> connections = wire(resolvedConnections, instances, trainCount, dropped);

        Map<String, Object> resolvedParameters = new LinkedHashMap<>();
        effective.forEach((k, v) -> resolvedParameters.put(k, v.toJava()));

        ExpansionResult result = ExpansionResult.builder()
                .flowsheetId("PFD_" + area)
                .sourceBlock(blockId)
                .equipment(instances.values())
                .connections(connections)
                .metadataEntry("sourceBlock", blockId)
                .metadataEntry("processUnitId", processId)
                .metadataEntry("areaNumber", area)
                .metadataEntry("trainCount", trainCount)
                .metadataEntry("templateUsed", template.getSourceFile())
                .metadataEntry("componentsUsed", template.getComponentsUsed())
                .metadataEntry("equipmentCount", instances.size())
                .metadataEntry("connectionCount", connections.size())
                .metadataEntry("droppedConnections", dropped.size())
                .metadataEntry("excludedEquipment", excluded)
                .metadataEntry("parameters", resolvedParameters)
                .build();

        log.info("Expanded '{}': {} equipment, {} connections ({} dropped, {} specs excluded)",
                blockId, instances.size(), connections.size(), dropped.size(), excluded.size());
        return result;
    }

    /**
     * Template defaults overridden by runtime values. Runtime values for declared
     * parameters must satisfy the declaration.
     */
    Map<String, ParameterValue> effectiveParameters(ProcessTemplate template, Map<String, ParameterValue> runtime) {
        Map<String, ParameterValue> effective = new LinkedHashMap<>();
        template.getParameters().forEach((name, spec) -> {
            if (spec.getDefaultValue() != null) {
                effective.put(name, spec.getDefaultValue());
            }
        });
        runtime.forEach((name, value) -> {
            ParameterSpec declared = template.getParameters().get(name);
            if (declared != null) {
                declared.validate(value);
            } else {
                log.debug("Runtime parameter '{}' is not declared by template '{}'", name, template.getProcessId());
            }
            effective.put(name, value);
        });
        return effective;
    }

    private boolean included(EquipmentSpec spec, Map<String, ParameterValue> params, List<String> excluded,
                             boolean record) {
        if (spec.getCondition() == null || spec.getCondition().isBlank()) {
            return true;
        }
        boolean include = conditionParser.parse(spec.getCondition()).evaluate(params);
        if (!include && record) {
            excluded.add(spec.localKey());
            log.debug("Excluded '{}': condition '{}' is false", spec.localKey(), spec.getCondition());
        }
        return include;
    }

    /** Substituted copy; the cached spec is left untouched. */
    private static EquipmentSpec substitute(EquipmentSpec spec, Map<String, ParameterValue> params) {
        Map<String, ParameterValue> defaults = new LinkedHashMap<>();
        spec.getDefaultParams().forEach((k, v) -> defaults.put(k, PlaceholderSubstitution.substitute(v, params)));
        return spec.toBuilder()
                .id(PlaceholderSubstitution.substitute(spec.getId(), params))
                .component(PlaceholderSubstitution.substitute(spec.getComponent(), params))
                .componentClass(PlaceholderSubstitution.substitute(spec.getComponentClass(), params))
                .tagPrefix(PlaceholderSubstitution.substitute(spec.getTagPrefix(), params))
                .mountTo(PlaceholderSubstitution.substitute(spec.getMountTo(), params))
                .clearDefaultParams()
                .defaultParams(defaults)
                .build();
    }

    /** Substituted copy of a connection line; boundary status is re-read from the result. */
    private static ConnectionSpec substitute(ConnectionSpec spec, Map<String, ParameterValue> params) {
        String from = PlaceholderSubstitution.substitute(spec.getFromEquipment(), params);
        String to = PlaceholderSubstitution.substitute(spec.getToEquipment(), params);
        String portMapping = PlaceholderSubstitution.substitute(spec.getPortMapping(), params);
        if (portMapping == null && (ConnectionDslParser.isBoundary(from) || ConnectionDslParser.isBoundary(to))) {
            portMapping = from + "." + spec.getFromPort() + " -> " + to + "." + spec.getToPort();
        }
        return spec.toBuilder()
                .fromEquipment(from)
                .toEquipment(to)
                .portMapping(portMapping)
                .build();
    }

    private EquipmentInstance instantiate(EquipmentSpec spec, String key, String tag, Integer train, int area) {
        ComponentDefinition definition = definitionFor(spec);
        Map<String, ParameterValue> parameters = new LinkedHashMap<>(spec.getDefaultParams());
        if (CUSTOM_COMPONENT.equals(definition.getId())) {
            parameters.putIfAbsent(ComponentFactory.TYPE_NAME_PARAMETER, ParameterValue.ofString(spec.localKey()));
        }
        Equipment equipment = factory.instantiate(definition, tag, parameters);

        EquipmentInstance.EquipmentInstanceBuilder builder = EquipmentInstance.builder()
                .id(key)
                .tag(equipment.getTagName())
                .componentClass(definition.getTargetClass())
                .equipment(equipment)
                .trainNumber(train)
                .parameters(spec.getDefaultParams())
                .ports(spec.getPorts())
                .metadataEntry("area", area)
                .metadataEntry("shared", train == null)
                .metadataEntry("specId", spec.localKey());
        if (spec.getMountTo() != null) {
            builder.metadataEntry("mountTo", spec.getMountTo());
        }
        return builder.build();
    }

    private ComponentDefinition definitionFor(EquipmentSpec spec) {
        ComponentRegistry registry = factory.getRegistry();
        if (spec.getComponent() != null) {
            return registry.resolve(spec.getComponent());
        }
        if (spec.getComponentClass() != null) {
            return registry.findByTargetClass(spec.getComponentClass())
                    .orElseThrow(() -> new UnknownComponentTypeException(spec.getComponentClass(), registry.knownKeys()));
        }
        return registry.resolve(CUSTOM_COMPONENT);
    }

    private static void register(Map<String, EquipmentInstance> instances, String key, EquipmentInstance instance) {
        if (instances.putIfAbsent(key, instance) != null) {
            throw new ConfigurationException("Duplicate equipment instance key '" + key
                    + "'; template ids must be unique");
        }
    }

    private List<ConnectionInstance> wire(List<ConnectionSpec> specs, Map<String, EquipmentInstance> instances,
                                          int trainCount, List<String> dropped) {
        List<ConnectionInstance> connections = new ArrayList<>();
        for (ConnectionSpec spec : specs) {
            List<EndpointPatternExpander.Endpoint> sources = patternExpander.expand(spec.getFromEquipment(), trainCount);
            List<EndpointPatternExpander.Endpoint> targets = patternExpander.expand(spec.getToEquipment(), trainCount);
            for (EndpointPatternExpander.Endpoint from : sources) {
                for (EndpointPatternExpander.Endpoint to : targets) {
                    if (!EndpointPatternExpander.pairs(from, to)) {
                        continue;
                    }
                    if (!known(from, instances) || !known(to, instances)) {
                        dropped.add(from.key() + " -> " + to.key());
                        log.warn("Dropped connection {} -> {}: no such equipment instance", from.key(), to.key());
                        continue;
                    }
                    ConnectionInstance.ConnectionInstanceBuilder builder = ConnectionInstance.builder()
                            .fromEquipment(from.key())
                            .fromPort(spec.getFromPort())
                            .toEquipment(to.key())
                            .toPort(spec.getToPort())
                            .streamKind(spec.getStreamKind())
                            .metadataEntry("perTrain", spec.isPerTrain());
                    if (spec.getPortMapping() != null) {
                        builder.metadataEntry("portMapping", spec.getPortMapping());
                    }
                    connections.add(builder.build());
                }
            }
        }
        return connections;
    }

    private static boolean known(EndpointPatternExpander.Endpoint endpoint, Map<String, EquipmentInstance> instances) {
        return endpoint.isBoundary() || instances.containsKey(endpoint.key());
    }
}
