package com.example.collectfaster;

import java.time.Duration;
import java.util.List;

/**
 * What a finished collection run did.
 */
public record CollectionSummary(
        TransferOperation operation,
        String destination,
        int transferredCount,
        int unmodifiedCount,
        ModifiedFileRecord modifiedFiles,
        List<TransferFailure> transferFailures,
        List<String> postProcessedFiles,
        boolean parallel,
        Duration elapsed
) {
    public CollectionSummary {
        transferFailures = List.copyOf(transferFailures);
        postProcessedFiles = List.copyOf(postProcessedFiles);
    }

    /**
     * Formats the closing line of a run, e.g.
     * {@code 3 static files copied to '/srv/static', 1 unmodified, 3 post-processed.}
     */
    public String describe() {
        int copied = transferredCount - transferFailures.size();
        StringBuilder builder = new StringBuilder();
        builder.append(copied)
                .append(copied == 1 ? " static file " : " static files ")
                .append(operation == TransferOperation.LINK ? "symlinked" : "copied")
                .append(" to '")
                .append(destination)
                .append('\'');
        if (unmodifiedCount > 0) {
            builder.append(", ").append(unmodifiedCount).append(" unmodified");
        }
        if (!transferFailures.isEmpty()) {
            builder.append(", ").append(transferFailures.size()).append(" failed");
        }
        if (!postProcessedFiles.isEmpty()) {
            builder.append(", ").append(postProcessedFiles.size()).append(" post-processed");
        }
        return builder.append('.').toString();
    }

    /**
     * Formats the timing line of a parallel run, e.g.
     * {@code 120 static files copied asynchronously in 3s.}
     */
    public String describeParallelRun() {
        return String.format("%d static files copied asynchronously in %ds.", transferredCount, elapsed.getSeconds());
    }
}
