package com.plantmodel.flowsheet.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads templates from a directory on disk.
 */
public class DirectoryTemplateSource implements TemplateSource {

    private final Path root;

    public DirectoryTemplateSource(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public Optional<InputStream> open(String relativePath) throws IOException {
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root.normalize()) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.newInputStream(file));
    }

    @Override
    public String describe(String relativePath) {
        return root.resolve(relativePath).toString();
    }
}
