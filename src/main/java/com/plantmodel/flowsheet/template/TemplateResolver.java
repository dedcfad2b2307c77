package com.plantmodel.flowsheet.template;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.exception.TemplateNotFoundException;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Loads process templates and composes them with reusable components and the shared
 * equipment library.
 *
 * The template root holds {@code registry.yaml} (process id to template file, plus the list
 * of component files) and an optional {@code equipment_library.yaml}. Resolved templates
 * are cached per registry key and never modified afterwards.
 */
public class TemplateResolver {
    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    static final String REGISTRY_FILE = "registry.yaml";
    static final String LIBRARY_FILE = "equipment_library.yaml";
    static final String LIBRARY_PREFIX = "equipment_library.";

    private static final Pattern CALL_SYNTAX = Pattern.compile("(\\w+)\\((.*)\\)");

    private final TemplateSource source;
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final ConnectionDslParser dslParser = new ConnectionDslParser();

    private final Map<String, String> templateFiles;
    private final Map<String, Map<String, Object>> components;
    private final Map<String, Map<String, Object>> library;
    private final Map<String, ProcessTemplate> cache = new ConcurrentHashMap<>();

    public TemplateResolver(TemplateSource source) {
        this.source = source;
        Map<String, Object> registry = readOptional(REGISTRY_FILE).orElseGet(() -> {
            log.warn("No {} found at {}; no templates are available", REGISTRY_FILE, source.describe(REGISTRY_FILE));
            return Map.of();
        });
        this.templateFiles = readTemplateFiles(registry);
        this.components = readComponents(registry);
        this.library = readLibrary();
        log.info("Template registry: {} templates, {} components, {} library entries",
                templateFiles.size(), components.size(), library.size());
    }

    /**
     * Returns the resolved template for a process id. An area-specific entry
     * {@code <area>_<processId>} wins over the plain id.
     *
     * @throws TemplateNotFoundException when no registry entry or file exists
     */
    public ProcessTemplate load(String processId, Integer areaNumber) {
        String key = templateKey(processId, areaNumber)
                .orElseThrow(() -> new TemplateNotFoundException(processId, templateFiles.keySet()));
        return cache.computeIfAbsent(key, this::resolve);
    }

    public boolean hasTemplate(String processId, Integer areaNumber) {
        return templateKey(processId, areaNumber).isPresent();
    }

    public Set<String> templateIds() {
        return Collections.unmodifiableSet(new TreeSet<>(templateFiles.keySet()));
    }

    public Set<String> componentIds() {
        return Collections.unmodifiableSet(new TreeSet<>(components.keySet()));
    }

    private Optional<String> templateKey(String processId, Integer areaNumber) {
        if (processId == null) {
            return Optional.empty();
        }
        if (areaNumber != null) {
            String areaKey = areaNumber + "_" + processId;
            if (templateFiles.containsKey(areaKey)) {
                return Optional.of(areaKey);
            }
        }
        return templateFiles.containsKey(processId) ? Optional.of(processId) : Optional.empty();
    }

    private ProcessTemplate resolve(String key) {
        String file = templateFiles.get(key);
        Map<String, Object> raw = readOptional(file).orElseThrow(() -> new TemplateNotFoundException(
                "Template file not found for '" + key + "': " + source.describe(file), key, templateFiles.keySet()));

        List<Map<String, Object>> perTrain = new ArrayList<>(mapList(raw.get("per_train_equipment")));
        List<Map<String, Object>> shared = new ArrayList<>(mapList(raw.get("shared_equipment")));
        List<Object> connectionBlocks = new ArrayList<>(connectionBlocks(raw.get("connections")));
        Map<String, String> portMappings = new LinkedHashMap<>(stringMap(raw.get("port_mappings")));
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>(parameterSpecs(raw.get("parameters")));
        List<String> used = new ArrayList<>();

        for (Object reference : list(raw.get("components"))) {
            composeComponent(reference, perTrain, shared, connectionBlocks, portMappings, parameters, used);
        }

        ProcessTemplate.ProcessTemplateBuilder builder = ProcessTemplate.builder()
                .processId(text(raw.getOrDefault("process_unit_id", key)))
                .areaNumber(raw.get("area_number") instanceof Number n ? n.intValue() : null)
                .name(text(raw.getOrDefault("name", key)))
                .description(text(raw.get("description")))
                .parameters(parameters)
                .portMappings(portMappings)
                .componentsUsed(used)
                .sourceFile(source.describe(file));

        for (Map<String, Object> equipment : perTrain) {
            builder.perTrainItem(toEquipmentSpec(resolveLibraryReference(equipment), false, key));
        }
        for (Map<String, Object> equipment : shared) {
            builder.sharedItem(toEquipmentSpec(resolveLibraryReference(equipment), true, key));
        }
        for (Object block : connectionBlocks) {
            builder.connections(toConnections(block));
        }

        ProcessTemplate template = builder.build();
        log.info("Resolved template '{}': {} per-train, {} shared, {} connections, components {}",
                key, template.getPerTrainEquipment().size(), template.getSharedEquipment().size(),
                template.getConnections().size(), used);
        return template;
    }

    private void composeComponent(Object reference,
                                  List<Map<String, Object>> perTrain,
                                  List<Map<String, Object>> shared,
                                  List<Object> connectionBlocks,
                                  Map<String, String> portMappings,
                                  Map<String, ParameterSpec> parameters,
                                  List<String> used) {
        String componentId;
        Map<String, ParameterValue> callParams = new LinkedHashMap<>();
        String condition = null;

        if (reference instanceof String id) {
            componentId = id.trim();
        } else if (reference instanceof Map<?, ?> map) {
            Map<?, ?> target = map;
            if (map.containsKey("$if")) {
                condition = text(map.get("$if"));
                target = map.get("then") instanceof Map<?, ?> then ? then : Map.of();
            } else {
                condition = text(map.get("condition"));
            }
            componentId = text(target.get("component") != null ? target.get("component") : target.get("id"));
            if (target.get("parameters") instanceof Map<?, ?> params) {
                params.forEach((k, v) -> callParams.put(String.valueOf(k), ParameterValue.of(v)));
            }
        } else {
            throw new ConfigurationException("Unsupported component reference: " + reference);
        }
        if (componentId == null || componentId.isBlank()) {
            throw new ConfigurationException("Component reference without id: " + reference);
        }

        Matcher call = CALL_SYNTAX.matcher(componentId);
        if (call.matches()) {
            componentId = call.group(1);
            for (String argument : call.group(2).split(",")) {
                if (argument.isBlank()) {
                    continue;
                }
                String[] pair = argument.split("=", 2);
                if (pair.length != 2) {
                    throw new ConfigurationException("Malformed component argument '" + argument.trim()
                            + "' in '" + reference + "'");
                }
                callParams.put(pair[0].trim(), ParameterValue.coerce(pair[1]));
            }
        }

        Map<String, Object> component = components.get(componentId);
        if (component == null) {
            throw new TemplateNotFoundException("Unknown template component '" + componentId + "'. Available ids: "
                    + new TreeSet<>(components.keySet()), componentId, components.keySet());
        }
        used.add(componentId);

        for (Map<String, Object> equipment : mapList(component.get("equipment"))) {
            @SuppressWarnings("unchecked")
            Map<String, Object> copy = (Map<String, Object>) substituteSupplied(equipment, callParams);
            if (condition != null && copy.get("condition") == null) {
                copy.put("condition", condition);
            }
            if (Boolean.TRUE.equals(copy.get("shared"))) {
                shared.add(copy);
            } else {
                perTrain.add(copy);
            }
        }
        for (Object block : connectionBlocks(component.get("connections"))) {
            connectionBlocks.add(substituteSupplied(block, callParams));
        }
        stringMap(component.get("port_mappings")).forEach((port, target) ->
                portMappings.put(port, PlaceholderSubstitution.substituteSupplied(target, callParams)));
        parameterSpecs(component.get("parameters")).forEach(parameters::putIfAbsent);
    }

    private Map<String, Object> resolveLibraryReference(Map<String, Object> equipment) {
        Object ref = equipment.containsKey("$ref") ? equipment.get("$ref") : equipment.get("ref");
        if (ref == null) {
            return equipment;
        }
        String name = ref.toString();
        if (name.startsWith(LIBRARY_PREFIX)) {
            name = name.substring(LIBRARY_PREFIX.length());
        }
        Map<String, Object> entry = library.get(name);
        if (entry == null) {
            throw new TemplateNotFoundException("Unknown equipment library entry '" + name + "'. Available ids: "
                    + new TreeSet<>(library.keySet()), name, library.keySet());
        }
        Map<String, Object> merged = new LinkedHashMap<>(entry);
        merged.putAll(equipment);
        merged.remove("$ref");
        merged.put("ref", name);
        return merged;
    }

    private EquipmentSpec toEquipmentSpec(Map<String, Object> raw, boolean sharedList, String templateKey) {
        String id = text(raw.get("id"));
        String prefix = text(raw.get("tag_prefix"));
        if (prefix == null) {
            prefix = id;
        }
        if (prefix == null) {
            throw new ConfigurationException("Equipment in template '" + templateKey + "' needs 'id' or 'tag_prefix': " + raw);
        }

        EquipmentSpec.EquipmentSpecBuilder builder = EquipmentSpec.builder()
                .id(id)
                .ref(text(raw.get("ref")))
                .component(text(raw.get("component")))
                .componentClass(text(firstPresent(raw, "class", "component_class", "dexpi_class")))
                .tagPrefix(prefix)
                .count(intValue(raw.get("count"), 1, "count", templateKey))
                .shared(sharedList || Boolean.TRUE.equals(raw.get("shared")))
                .mountTo(text(raw.get("mount_to")))
                .condition(text(raw.get("condition")));

        if (raw.get("default_params") instanceof Map<?, ?> defaults) {
            defaults.forEach((k, v) -> builder.defaultParam(String.valueOf(k), ParameterValue.of(v)));
        }
        for (Map<String, Object> port : mapList(raw.get("ports"))) {
            builder.port(PortDefinition.builder()
                    .name(text(port.get("name")))
                    .direction(text(port.get("direction")))
                    .type(port.get("type") != null ? text(port.get("type")) : "Standard")
                    .nominalDiameter(text(port.get("nominal_diameter")))
                    .build());
        }
        return builder.build();
    }

    private List<ConnectionSpec> toConnections(Object block) {
        if (block instanceof String dsl) {
            return dslParser.parse(dsl);
        }
        if (block instanceof Map<?, ?> map) {
            ConnectionSpec parsed = dslParser.parseLine(text(map.get("from")) + " -> " + text(map.get("to")));
            ConnectionSpec.ConnectionSpecBuilder builder = parsed.toBuilder();
            if (map.get("stream_type") != null) {
                builder.streamKind(text(map.get("stream_type")));
            }
            if (map.get("per_train") instanceof Boolean perTrain) {
                builder.perTrain(perTrain);
            }
            return List.of(builder.build());
        }
        throw new ConfigurationException("Unsupported connection entry: " + block);
    }

    private Map<String, ParameterSpec> parameterSpecs(Object raw) {
        Map<String, ParameterSpec> specs = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) {
            return specs;
        }
        map.forEach((name, data) -> {
            ParameterSpec.ParameterSpecBuilder builder = ParameterSpec.builder().name(String.valueOf(name));
            if (data instanceof Map<?, ?> fields) {
                if (fields.get("type") != null) {
                    builder.type(text(fields.get("type")));
                }
                if (fields.containsKey("default")) {
                    builder.defaultValue(ParameterValue.of(fields.get("default")));
                }
                list(fields.get("values")).forEach(v -> builder.value(ParameterValue.of(v)));
                builder.min(decimal(fields.get("min")));
                builder.max(decimal(fields.get("max")));
                list(fields.get("affects")).forEach(a -> builder.affect(String.valueOf(a)));
            } else {
                builder.defaultValue(ParameterValue.of(data));
            }
            specs.put(String.valueOf(name), builder.build());
        });
        return specs;
    }

    private Map<String, String> readTemplateFiles(Map<String, Object> registry) {
        Map<String, String> files = new LinkedHashMap<>();
        if (registry.get("templates") instanceof Map<?, ?> templates) {
            templates.forEach((k, v) -> files.put(String.valueOf(k), String.valueOf(v)));
        }
        return files;
    }

    private Map<String, Map<String, Object>> readComponents(Map<String, Object> registry) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Object file : list(registry.get("components"))) {
            String path = String.valueOf(file);
            Map<String, Object> component = readOptional(path).orElseThrow(() ->
                    new ConfigurationException("Component file listed in registry is missing: " + source.describe(path)));
            String id = text(component.get("id"));
            if (id == null) {
                throw new ConfigurationException("Component file " + source.describe(path) + " has no 'id'");
            }
            result.put(id, component);
        }
        return result;
    }

    private Map<String, Map<String, Object>> readLibrary() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        Map<String, Object> document = readOptional(LIBRARY_FILE).orElse(Map.of());
        if (document.get("equipment") instanceof Map<?, ?> entries) {
            entries.forEach((k, v) -> {
                if (!(v instanceof Map<?, ?>)) {
                    throw new ConfigurationException("Equipment library entry '" + k + "' is not a mapping");
                }
                result.put(String.valueOf(k), asStringKeyed((Map<?, ?>) v));
            });
        }
        return result;
    }

    private Optional<Map<String, Object>> readOptional(String relativePath) {
        try {
            Optional<InputStream> in = source.open(relativePath);
            if (in.isEmpty()) {
                return Optional.empty();
            }
            try (InputStream stream = in.get()) {
                Map<String, Object> document = mapper.readValue(stream, new TypeReference<Map<String, Object>>() {
                });
                return Optional.of(document == null ? new LinkedHashMap<>() : document);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read template resource " + source.describe(relativePath), e);
        }
    }

    /** Deep copy with supplied call parameters substituted into every string. */
    private static Object substituteSupplied(Object value, Map<String, ParameterValue> params) {
        if (value instanceof String s) {
            return PlaceholderSubstitution.substituteSupplied(s, params);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), substituteSupplied(v, params)));
            return copy;
        }
        if (value instanceof List<?> items) {
            List<Object> copy = new ArrayList<>();
            items.forEach(item -> copy.add(substituteSupplied(item, params)));
            return copy;
        }
        return value;
    }

    private static List<Object> connectionBlocks(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> items) {
            return new ArrayList<>(items);
        }
        return List.of(raw);
    }

    private static List<Map<String, Object>> mapList(Object raw) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list(raw)) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new ConfigurationException("Expected a mapping but found: " + item);
            }
            result.add(asStringKeyed(map));
        }
        return result;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static List<?> list(Object raw) {
        return raw instanceof List<?> items ? items : List.of();
    }

    private static Map<String, String> stringMap(Object raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        }
        return result;
    }

    private static Object firstPresent(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            if (raw.get(key) != null) {
                return raw.get(key);
            }
        }
        return null;
    }

    private static int intValue(Object raw, int defaultValue, String field, String templateKey) {
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Field '" + field + "' in template '" + templateKey
                    + "' must be an integer, got '" + raw + "'", e);
        }
    }

    private static BigDecimal decimal(Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected a number but found '" + raw + "'", e);
        }
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
