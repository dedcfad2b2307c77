package com.plantmodel.flowsheet.context;

import java.nio.file.Path;
import java.util.Optional;

import com.plantmodel.flowsheet.notation.NotationVersion;

import lombok.Builder;
import lombok.Data;

/**
 * Settings shared by the registry, the factory and the engines.
 *
 * Templates load from the classpath under {@link #templateBasePath} unless
 * {@link #templatesDir} points at a directory on disk.
 */
@Data
@Builder(toBuilder = true)
public class ConverterConfig {

    public static final String TEMPLATES_DIR_PROPERTY = "flowsheet.templates.dir";
    public static final String TEMPLATES_DIR_ENV = "FLOWSHEET_TEMPLATES_DIR";

    /**
     * Classpath location of the process templates.
     */
    @Builder.Default
    private String templateBasePath = "process-templates";

    /**
     * Filesystem template directory; wins over the classpath location when set.
     */
    private Path templatesDir;

    /**
     * Classpath resource holding the component registry.
     */
    @Builder.Default
    private String componentRegistryResource = "component-registry.yaml";

    @Builder.Default
    private String defaultNominalDiameter = "DN50";

    @Builder.Default
    private String defaultNominalDiameterNumeric = "50";

    @Builder.Default
    private String defaultNominalPressure = "PN16";

    @Builder.Default
    private String defaultPipingClass = "CS150";

    @Builder.Default
    private String pipingSystemId = "main_piping_system";

    @Builder.Default
    private NotationVersion notationVersion = NotationVersion.V2;

    public Optional<Path> getTemplatesDir() {
        return Optional.ofNullable(templatesDir);
    }

    /**
     * Defaults with the template directory taken from the system property, then the
     * environment variable.
     */
    public static ConverterConfig fromEnvironment() {
        String dir = System.getProperty(TEMPLATES_DIR_PROPERTY);
        if (dir == null || dir.isBlank()) {
            dir = System.getenv(TEMPLATES_DIR_ENV);
        }
        ConverterConfigBuilder builder = ConverterConfig.builder();
        if (dir != null && !dir.isBlank()) {
            builder.templatesDir(Path.of(dir));
        }
        return builder.build();
    }
}
