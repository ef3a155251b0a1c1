package com.example.collectfaster.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Origin of collected files. Paths passed in are relative to the location.
 */
public interface SourceLocation {
    String name();

    Path resolve(String sourcePath);

    Instant modifiedTime(String sourcePath) throws IOException;
}
