package com.example.collectfaster;

import java.time.Instant;

public record TransferFailure(
        TransferTask task,
        String workerName,
        Instant failedAt,
        TransferException error
) {
    public String destinationPath() {
        return task.destinationPath();
    }
}
