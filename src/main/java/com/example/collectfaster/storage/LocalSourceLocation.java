package com.example.collectfaster.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Source directory on the local filesystem.
 */
public record LocalSourceLocation(Path root) implements SourceLocation {
    public LocalSourceLocation {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        root = root.toAbsolutePath().normalize();
    }

    @Override
    public String name() {
        return root.toString();
    }

    @Override
    public Path resolve(String sourcePath) {
        return root.resolve(sourcePath).normalize();
    }

    @Override
    public Instant modifiedTime(String sourcePath) throws IOException {
        return Files.getLastModifiedTime(resolve(sourcePath)).toInstant();
    }

    @Override
    public String toString() {
        return name();
    }
}
