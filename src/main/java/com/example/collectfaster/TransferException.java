package com.example.collectfaster;

import java.util.Locale;

/**
 * A single copy or link operation failed against the destination storage.
 */
public class TransferException extends Exception {
    private final TransferTask task;

    public TransferException(TransferTask task, Throwable cause) {
        super(String.format("Failed to %s '%s' to '%s': %s",
                task.operation().name().toLowerCase(Locale.ROOT),
                task.sourcePath(),
                task.destinationPath(),
                cause.getMessage()), cause);
        this.task = task;
    }

    public TransferTask getTask() {
        return task;
    }

    public String getDestinationPath() {
        return task.destinationPath();
    }
}
