package com.example.collectfaster;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for a collection run.
 */
public record CollectConfig(
        List<Source> sources,
        List<String> ignorePatterns,
        Destination destination,
        boolean faster,
        int workers,
        boolean useMultiprocessing,
        boolean link,
        boolean dryRun,
        boolean postProcess
) {
    public CollectConfig {
        sources = List.copyOf(sources);
        ignorePatterns = List.copyOf(ignorePatterns);
    }

    public TransferOperation operation() {
        return link ? TransferOperation.LINK : TransferOperation.COPY;
    }

    /**
     * A source directory, optionally stored under a path prefix.
     */
    public record Source(Path path, Optional<String> prefix) {
    }

    public record Destination(
            DestinationType type,
            Optional<Path> root,
            Optional<String> bucket,
            String location,
            Optional<String> region,
            boolean hashedNames
    ) {
        public static Destination local(Path root, boolean hashedNames) {
            return new Destination(DestinationType.LOCAL, Optional.of(root), Optional.empty(), "", Optional.empty(), hashedNames);
        }
    }

    public enum DestinationType {
        LOCAL,
        S3
    }
}
