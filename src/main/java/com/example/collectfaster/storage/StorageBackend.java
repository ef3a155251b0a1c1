package com.example.collectfaster.storage;

import com.example.collectfaster.postprocess.PostProcessor;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Optional;

/**
 * Destination storage for collected files. Implementations must tolerate
 * concurrent calls from several transfer workers.
 */
public interface StorageBackend {
    /**
     * Human readable description of where files end up, used in run summaries.
     */
    String describe();

    boolean exists(String path) throws IOException;

    Optional<Instant> modifiedTime(String path) throws IOException;

    default boolean isLink(String path) throws IOException {
        return false;
    }

    void copy(String sourcePath, String destinationPath, SourceLocation source) throws IOException;

    void link(String sourcePath, String destinationPath, SourceLocation source) throws IOException;

    void delete(String path) throws IOException;

    InputStream open(String path) throws IOException;

    void write(String path, byte[] content) throws IOException;

    /**
     * Post-processing step offered by this storage, if any.
     */
    default Optional<PostProcessor> postProcessor() {
        return Optional.empty();
    }
}
