package com.plantmodel.flowsheet.template;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Location process templates are read from. Paths are relative to the template root and
 * use {@code /} separators.
 */
public interface TemplateSource {

    /**
     * Opens a template resource, or returns empty when it does not exist.
     */
    Optional<InputStream> open(String relativePath) throws IOException;

    /**
     * Human-readable location of a resource, used in messages and metadata.
     */
    String describe(String relativePath);
}
