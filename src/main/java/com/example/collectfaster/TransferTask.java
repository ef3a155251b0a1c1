package com.example.collectfaster;

import com.example.collectfaster.storage.SourceLocation;

/**
 * One copy or link operation waiting to be applied to the destination storage.
 */
public record TransferTask(
        TransferOperation operation,
        String sourcePath,
        String destinationPath,
        SourceLocation sourceLocation
) {
    public TransferTask {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (destinationPath == null || destinationPath.isBlank()) {
            throw new IllegalArgumentException("destinationPath cannot be blank");
        }
    }

    public static TransferTask copy(String sourcePath, String destinationPath, SourceLocation sourceLocation) {
        return new TransferTask(TransferOperation.COPY, sourcePath, destinationPath, sourceLocation);
    }

    public static TransferTask link(String sourcePath, String destinationPath, SourceLocation sourceLocation) {
        return new TransferTask(TransferOperation.LINK, sourcePath, destinationPath, sourceLocation);
    }
}
