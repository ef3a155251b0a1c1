package com.example.collectfaster;

import com.example.collectfaster.storage.SourceLocation;

/**
 * A source file discovered by a {@link Finder}, with the path it will be stored as.
 */
public record FoundFile(
        String sourcePath,
        String destinationPath,
        SourceLocation sourceLocation
) {
}
