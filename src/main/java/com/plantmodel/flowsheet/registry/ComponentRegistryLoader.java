package com.plantmodel.flowsheet.registry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Reads component definitions from a YAML document with a top-level {@code components} list.
 *
 * <pre>
 * components:
 *   - id: pump
 *     aliases: [pump_centrifugal]
 *     target_class: CentrifugalPump
 *     abstract_block: pumping
 *     category: rotating
 *     nozzles: {default: 2, min: 1, max: 4}
 *     optional_attributes: [flowRate, head, power]
 *     primary: true
 * </pre>
 */
public class ComponentRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(ComponentRegistryLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public ComponentRegistry loadFromClasspath(String resource) {
        String path = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream in = ComponentRegistryLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new ConfigurationException("Component registry resource not found on classpath: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read component registry " + resource, e);
        }
    }

    public ComponentRegistry loadFromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read component registry " + file, e);
        }
    }

    ComponentRegistry load(InputStream in, String source) throws IOException {
        Map<String, Object> document = mapper.readValue(in, new TypeReference<Map<String, Object>>() {
        });
        if (document == null || !(document.get("components") instanceof List<?> entries)) {
            throw new ConfigurationException("Component registry " + source + " has no 'components' list");
        }

        List<ComponentDefinition> definitions = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> raw)) {
                throw new ConfigurationException("Malformed component entry in " + source + ": " + entry);
            }
            definitions.add(toDefinition(raw, source));
        }
        log.info("Loaded {} component definitions from {}", definitions.size(), source);
        return new ComponentRegistry(definitions);
    }

    private ComponentDefinition toDefinition(Map<?, ?> raw, String source) {
        String id = text(raw.get("id"));
        String targetClass = text(raw.get("target_class"));
        if (id == null || targetClass == null) {
            throw new ConfigurationException("Component entry in " + source + " needs 'id' and 'target_class': " + raw);
        }

        ComponentDefinition.ComponentDefinitionBuilder builder = ComponentDefinition.builder()
                .id(id)
                .targetClass(targetClass)
                .abstractBlock(text(raw.get("abstract_block")))
                .category(ComponentCategory.fromString(text(raw.get("category"))))
                .displayName(text(raw.get("display_name")))
                .description(text(raw.get("description")))
                .symbolId(text(raw.get("symbol_id")))
                .primary(Boolean.TRUE.equals(raw.get("primary")))
                .expansionTemplate(text(raw.get("expansion_template")));

        if (raw.get("aliases") instanceof List<?> aliases) {
            aliases.forEach(a -> builder.alias(String.valueOf(a)));
        }
        if (raw.get("optional_attributes") instanceof List<?> attributes) {
            attributes.forEach(a -> builder.optionalAttribute(String.valueOf(a)));
        }
        if (raw.get("nozzles") instanceof Map<?, ?> nozzles) {
            if (nozzles.get("default") instanceof Number n) {
                builder.nozzleCountDefault(n.intValue());
            }
            if (nozzles.get("min") instanceof Number n) {
                builder.nozzleCountMin(n.intValue());
            }
            if (nozzles.get("max") instanceof Number n) {
                builder.nozzleCountMax(n.intValue());
            }
        }
        if (raw.get("expansion_parameters") instanceof Map<?, ?> parameters) {
            parameters.forEach((k, v) -> builder.expansionParameter(String.valueOf(k), ParameterValue.of(v)));
        }

        ComponentDefinition definition = builder.build();
        if (definition.getNozzleCountMax() != null && definition.getNozzleCountDefault() > definition.getNozzleCountMax()) {
            throw new ConfigurationException("Component '" + id + "' default nozzle count "
                    + definition.getNozzleCountDefault() + " exceeds max " + definition.getNozzleCountMax());
        }
        return definition;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
