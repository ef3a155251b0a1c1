package com.example.collectfaster;

import com.example.collectfaster.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Applies a single transfer task to the destination storage. Failures are reported,
 * never retried; retrying is left to the storage client.
 */
public final class TransferExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransferExecutor.class);

    private final StorageBackend storage;
    private final boolean dryRun;

    public TransferExecutor(StorageBackend storage) {
        this(storage, false);
    }

    public TransferExecutor(StorageBackend storage, boolean dryRun) {
        this.storage = storage;
        this.dryRun = dryRun;
    }

    public void execute(TransferTask task) throws TransferException {
        if (dryRun) {
            LOGGER.info("Pretending to {} '{}'", verb(task), task.sourceLocation().resolve(task.sourcePath()));
            return;
        }
        try {
            if (task.operation() == TransferOperation.LINK) {
                storage.link(task.sourcePath(), task.destinationPath(), task.sourceLocation());
            } else {
                storage.copy(task.sourcePath(), task.destinationPath(), task.sourceLocation());
            }
        } catch (IOException | RuntimeException ex) {
            throw new TransferException(task, ex);
        }
        LOGGER.debug("{} '{}' to '{}'", task.operation() == TransferOperation.LINK ? "Linked" : "Copied",
                task.sourcePath(), task.destinationPath());
    }

    public StorageBackend storage() {
        return storage;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    private String verb(TransferTask task) {
        return task.operation() == TransferOperation.LINK ? "link" : "copy";
    }
}
