package com.plantmodel.flowsheet.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.exception.TemplateNotFoundException;
import com.plantmodel.flowsheet.exception.UnknownComponentTypeException;

/**
 * Read-only lookup from type keys to component definitions.
 *
 * A key resolves as an alias first, then as an abstract block id, then as a target class
 * id. Alias and block keys are case-insensitive; class ids are exact. There is no generic
 * fallback definition.
 */
public class ComponentRegistry {
    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final List<ComponentDefinition> definitions;
    private final Map<String, ComponentDefinition> byAlias = new LinkedHashMap<>();
    private final Map<String, ComponentDefinition> byAbstractBlock = new LinkedHashMap<>();
    private final Map<String, ComponentDefinition> byTargetClass = new LinkedHashMap<>();

    public ComponentRegistry(List<ComponentDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
        for (ComponentDefinition definition : this.definitions) {
            for (String alias : definition.allAliases()) {
                ComponentDefinition previous = byAlias.putIfAbsent(normalize(alias), definition);
                if (previous != null && previous != definition) {
                    throw new ConfigurationException("Alias '" + alias + "' is registered by both '"
                            + previous.getId() + "' and '" + definition.getId() + "'");
                }
            }
            definition.getAbstractBlockId().ifPresent(block -> byAbstractBlock.putIfAbsent(normalize(block), definition));

            ComponentDefinition existing = byTargetClass.get(definition.getTargetClass());
            if (existing == null || (definition.isPrimary() && !existing.isPrimary())) {
                byTargetClass.put(definition.getTargetClass(), definition);
            }
        }
        log.debug("Registry indexed {} aliases, {} abstract blocks, {} target classes",
                byAlias.size(), byAbstractBlock.size(), byTargetClass.size());
    }

    /**
     * Resolves any type key or fails with the full set of known keys.
     */
    public ComponentDefinition resolve(String key) {
        return find(key).orElseThrow(() -> new UnknownComponentTypeException(key, knownKeys()));
    }

    public Optional<ComponentDefinition> find(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(key);
        if (byAlias.containsKey(normalized)) {
            return Optional.of(byAlias.get(normalized));
        }
        if (byAbstractBlock.containsKey(normalized)) {
            return Optional.of(byAbstractBlock.get(normalized));
        }
        return Optional.ofNullable(byTargetClass.get(key.trim()));
    }

    /**
     * Resolves a key that must map to an abstract block: either a block id or an alias
     * whose definition declares one.
     */
    public ComponentDefinition resolveAbstractBlock(String key) {
        return findAbstractBlock(key).orElseThrow(() -> new TemplateNotFoundException(key, abstractBlockIds()));
    }

    public Optional<ComponentDefinition> findAbstractBlock(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(key);
        ComponentDefinition definition = byAbstractBlock.get(normalized);
        if (definition == null) {
            definition = byAlias.get(normalized);
        }
        if (definition == null || definition.getAbstractBlockId().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(definition);
    }

    public boolean isAbstractBlock(String key) {
        return findAbstractBlock(key).isPresent();
    }

    /**
     * Reverse lookup used when reading a plant model back; the primary definition wins.
     */
    public Optional<ComponentDefinition> findByTargetClass(String targetClass) {
        return Optional.ofNullable(byTargetClass.get(targetClass));
    }

    public List<ComponentDefinition> findByCategory(ComponentCategory category) {
        return definitions.stream().filter(d -> d.getCategory() == category).toList();
    }

    public List<ComponentDefinition> getDefinitions() {
        return definitions;
    }

    /** Every alias, block id and class id, sorted. */
    public List<String> knownKeys() {
        Set<String> keys = new TreeSet<>(byAlias.keySet());
        keys.addAll(byAbstractBlock.keySet());
        keys.addAll(byTargetClass.keySet());
        return new ArrayList<>(keys);
    }

    public List<String> abstractBlockIds() {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(byAbstractBlock.keySet())));
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
