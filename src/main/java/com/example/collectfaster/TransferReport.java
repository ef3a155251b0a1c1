package com.example.collectfaster;

import java.util.List;

/**
 * Outcome of draining the task queue: how many tasks were attempted and which failed.
 */
public record TransferReport(
        int attempted,
        List<TransferFailure> failures
) {
    public TransferReport {
        failures = List.copyOf(failures);
    }

    public int succeeded() {
        return attempted - failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
