package com.example.collectfaster;

import com.example.collectfaster.storage.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Destination paths touched by a collection run, in discovery order, each mapped
 * to the source it was collected from.
 * <p>
 * Entries are recorded by the discovery thread before the matching task is queued,
 * so the record never depends on which worker ran a transfer or when.
 */
public final class ModifiedFileRecord {
    private final Map<String, SourceFile> files = new LinkedHashMap<>();
    private boolean sealed;

    public record SourceFile(SourceLocation location, String sourcePath) {
    }

    /**
     * Records the source for a destination path. A later call for the same destination
     * replaces the source but keeps the original position.
     */
    public void record(String destinationPath, SourceLocation location, String sourcePath) {
        if (sealed) {
            throw new IllegalStateException("Record is read-only once post-processing has started");
        }
        files.put(destinationPath, new SourceFile(location, sourcePath));
    }

    /**
     * Makes the record read-only.
     */
    public ModifiedFileRecord seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Optional<SourceFile> get(String destinationPath) {
        return Optional.ofNullable(files.get(destinationPath));
    }

    public boolean contains(String destinationPath) {
        return files.containsKey(destinationPath);
    }

    public List<String> destinationPaths() {
        return List.copyOf(files.keySet());
    }

    public Map<String, SourceFile> entries() {
        return Collections.unmodifiableMap(files);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
