package com.plantmodel.flowsheet.context;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.conversion.ConnectionBuilder;
import com.plantmodel.flowsheet.conversion.ControlUnitClassifier;
import com.plantmodel.flowsheet.conversion.ConversionEngine;
import com.plantmodel.flowsheet.conversion.PlantModelExtractor;
import com.plantmodel.flowsheet.expansion.ExpansionEngine;
import com.plantmodel.flowsheet.graph.ConnectivityGraphProjector;
import com.plantmodel.flowsheet.notation.NotationParser;
import com.plantmodel.flowsheet.notation.NotationWriter;
import com.plantmodel.flowsheet.plant.PipingToolkit;
import com.plantmodel.flowsheet.registry.ComponentFactory;
import com.plantmodel.flowsheet.registry.ComponentRegistry;
import com.plantmodel.flowsheet.registry.ComponentRegistryLoader;
import com.plantmodel.flowsheet.template.ClasspathTemplateSource;
import com.plantmodel.flowsheet.template.DirectoryTemplateSource;
import com.plantmodel.flowsheet.template.TemplateResolver;
import com.plantmodel.flowsheet.template.TemplateSource;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Everything a conversion needs, wired once and passed by reference.
 */
@Getter
@Builder(toBuilder = true)
public final class ConverterContext {
    private static final Logger log = LoggerFactory.getLogger(ConverterContext.class);

    @NonNull
    private final ConverterConfig config;

    @NonNull
    private final ComponentRegistry registry;

    @NonNull
    private final ComponentFactory factory;

    @NonNull
    private final TemplateResolver templateResolver;

    @NonNull
    private final ExpansionEngine expansionEngine;

    @NonNull
    private final ConversionEngine conversionEngine;

    /**
     * Builds a context from configuration: registry from its classpath resource,
     * templates from the configured directory or the classpath.
     */
    public static ConverterContext create(ConverterConfig config) {
        ComponentRegistry registry = new ComponentRegistryLoader().loadFromClasspath(config.getComponentRegistryResource());
        TemplateSource source = config.getTemplatesDir()
                .<TemplateSource>map(DirectoryTemplateSource::new)
                .orElseGet(() -> new ClasspathTemplateSource(config.getTemplateBasePath()));
        return create(config, registry, source);
    }

    public static ConverterContext create(ConverterConfig config, ComponentRegistry registry, TemplateSource templates) {
        ComponentFactory factory = new ComponentFactory(registry, config);
        TemplateResolver resolver = new TemplateResolver(templates);
        ExpansionEngine expansionEngine = new ExpansionEngine(resolver, factory);
        ControlUnitClassifier classifier = new ControlUnitClassifier();

        ConversionEngine conversionEngine = new ConversionEngine(
                new NotationParser(),
                new NotationWriter(),
                factory,
                expansionEngine,
                new ConnectionBuilder(factory, config, new PipingToolkit()),
                new PlantModelExtractor(registry, new ConnectivityGraphProjector(), classifier),
                classifier);

        log.info("Converter context ready: {} component definitions, templates from {}",
                registry.getDefinitions().size(), config.getTemplatesDir().map(Path::toString).orElse("classpath"));
        return ConverterContext.builder()
                .config(config)
                .registry(registry)
                .factory(factory)
                .templateResolver(resolver)
                .expansionEngine(expansionEngine)
                .conversionEngine(conversionEngine)
                .build();
    }

    /**
     * Process-wide context built from {@link ConverterConfig#fromEnvironment()} on first use.
     */
    public static ConverterContext defaults() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        private static final ConverterContext INSTANCE = create(ConverterConfig.fromEnvironment());
    }
}
