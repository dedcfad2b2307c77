package com.plantmodel.flowsheet.template;

import java.io.InputStream;
import java.util.Optional;

/**
 * Reads templates from the classpath below a base path.
 */
public class ClasspathTemplateSource implements TemplateSource {

    private final String basePath;

    public ClasspathTemplateSource(String basePath) {
        String trimmed = basePath.startsWith("/") ? basePath.substring(1) : basePath;
        this.basePath = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    @Override
    public Optional<InputStream> open(String relativePath) {
        return Optional.ofNullable(ClasspathTemplateSource.class.getClassLoader()
                .getResourceAsStream(basePath + "/" + relativePath));
    }

    @Override
    public String describe(String relativePath) {
        return "classpath:" + basePath + "/" + relativePath;
    }
}
