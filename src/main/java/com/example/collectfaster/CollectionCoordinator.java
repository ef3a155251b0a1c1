package com.example.collectfaster;

import com.example.collectfaster.postprocess.PostProcessResult;
import com.example.collectfaster.postprocess.PostProcessor;
import com.example.collectfaster.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Orchestrates a collection run: discover files, transfer them either inline or through
 * the worker pool, then hand the set of touched files to the storage's post-processor.
 * <p>
 * In sequential mode every transfer runs inline while discovering and the first failure
 * aborts the run. In parallel mode discovery only records and queues; the queue is drained
 * by the worker pool, transfer failures are reported but do not stop the run, and
 * post-processing starts only after every queued task has been attempted.
 * <p>
 * When several sources map to one destination, both modes leave the last discovered
 * source on the destination: sequential mode by overwriting in order, parallel mode by
 * skipping every queued task the record no longer points at.
 */
public final class CollectionCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CollectionCoordinator.class);

    private final CollectConfig config;
    private final Finder finder;
    private final StorageBackend storage;
    private final WorkerPool workerPool;
    private volatile CollectionState state = CollectionState.IDLE;

    public CollectionCoordinator(CollectConfig config, Finder finder, StorageBackend storage) {
        this(config, finder, storage, config.useMultiprocessing()
                ? new DedicatedThreadConcurrencyBackend()
                : new ExecutorConcurrencyBackend());
    }

    public CollectionCoordinator(CollectConfig config,
                                 Finder finder,
                                 StorageBackend storage,
                                 ConcurrencyBackend concurrencyBackend) {
        if (config.faster() && config.workers() <= 0) {
            throw new ConfigurationException("Worker count must be positive, got " + config.workers());
        }
        this.config = config;
        this.finder = finder;
        this.storage = storage;
        this.workerPool = new WorkerPool(concurrencyBackend);
    }

    public CollectionState state() {
        return state;
    }

    /**
     * Executes one collection run. A coordinator can run only once.
     */
    public CollectionSummary collect() throws IOException, TransferException, PostProcessException, InterruptedException {
        if (state != CollectionState.IDLE) {
            throw new IllegalStateException("Collection already ran, state is " + state);
        }
        Instant started = Instant.now();
        try {
            return doCollect(started);
        } catch (Exception ex) {
            state = CollectionState.FAILED;
            throw ex;
        }
    }

    private CollectionSummary doCollect(Instant started)
            throws IOException, TransferException, PostProcessException, InterruptedException {
        TransferExecutor executor = new TransferExecutor(storage, config.dryRun());
        ModifiedFileRecord modifiedFiles = new ModifiedFileRecord();
        TaskQueue queue = new TaskQueue();
        Set<String> transferredThisRun = new HashSet<>();
        int transferredCount = 0;
        int unmodifiedCount = 0;

        state = config.faster() ? CollectionState.DISCOVERING : CollectionState.SEQUENTIAL;
        try (Stream<FoundFile> files = finder.list()) {
            Iterator<FoundFile> iterator = files.iterator();
            while (iterator.hasNext()) {
                FoundFile file = iterator.next();
                TransferTask task = new TransferTask(
                        config.operation(),
                        file.sourcePath(),
                        file.destinationPath(),
                        file.sourceLocation()
                );
                // Membership is recorded before the task runs anywhere.
                modifiedFiles.record(file.destinationPath(), file.sourceLocation(), file.sourcePath());

                if (config.faster()) {
                    queue.put(task);
                    transferredCount++;
                    continue;
                }

                boolean overwrite = transferredThisRun.contains(task.destinationPath());
                if (!overwrite && !deleteStaleFile(task)) {
                    unmodifiedCount++;
                    continue;
                }
                if (!config.dryRun()) {
                    LOGGER.info("{} '{}'", task.operation() == TransferOperation.LINK ? "Linking" : "Copying",
                            task.sourceLocation().resolve(task.sourcePath()));
                }
                try {
                    executor.execute(task);
                } catch (TransferException ex) {
                    LOGGER.error("Transfer of '{}' failed", task.destinationPath());
                    throw ex;
                }
                transferredThisRun.add(task.destinationPath());
                transferredCount++;
            }
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }

        modifiedFiles.seal();
        List<TransferFailure> failures = List.of();
        if (config.faster()) {
            state = CollectionState.PARALLEL;
            TransferReport report = workerPool.run(queue, executor, config.workers(),
                    task -> isRecordedSource(modifiedFiles, task));
            failures = report.failures();
            for (TransferFailure failure : failures) {
                LOGGER.error("Transfer of '{}' failed", failure.destinationPath(), failure.error());
            }
            LOGGER.debug("{} of {} queued transfers succeeded", report.succeeded(), report.attempted());
        }

        List<String> postProcessed = postProcess(modifiedFiles);

        Duration elapsed = Duration.between(started, Instant.now());
        CollectionSummary summary = new CollectionSummary(
                config.operation(),
                storage.describe(),
                transferredCount,
                unmodifiedCount,
                modifiedFiles,
                failures,
                postProcessed,
                config.faster(),
                elapsed
        );
        if (config.faster()) {
            LOGGER.info(summary.describeParallelRun());
        }
        state = CollectionState.DONE;
        return summary;
    }

    private static boolean isRecordedSource(ModifiedFileRecord modifiedFiles, TransferTask task) {
        return modifiedFiles.get(task.destinationPath())
                .map(entry -> entry.location().equals(task.sourceLocation())
                        && entry.sourcePath().equals(task.sourcePath()))
                .orElse(true);
    }

    /**
     * Clears the way for a transfer to {@code task.destinationPath()}. Returns false when
     * the destination is already up to date and the transfer can be skipped.
     * <p>
     * In parallel mode this always returns true without touching storage: every destination
     * is overwritten by its transfer anyway. Destinations that no source produces any more
     * are therefore left in place.
     */
    boolean deleteStaleFile(TransferTask task) throws TransferException {
        if (config.faster()) {
            return true;
        }
        String destination = task.destinationPath();
        try {
            if (!storage.exists(destination)) {
                return true;
            }
            Optional<Instant> targetModified = storage.modifiedTime(destination);
            Instant sourceModified = task.sourceLocation().modifiedTime(task.sourcePath());
            boolean wantLink = task.operation() == TransferOperation.LINK;
            if (targetModified.isPresent()
                    && !targetModified.get().isBefore(sourceModified)
                    && wantLink == storage.isLink(destination)) {
                LOGGER.debug("Skipping '{}' (not modified)", destination);
                return false;
            }
            if (config.dryRun()) {
                LOGGER.info("Pretending to delete '{}'", destination);
            } else {
                LOGGER.debug("Deleting '{}'", destination);
                storage.delete(destination);
            }
            return true;
        } catch (IOException ex) {
            LOGGER.error("Transfer of '{}' failed", destination);
            throw new TransferException(task, ex);
        }
    }

    private List<String> postProcess(ModifiedFileRecord modifiedFiles) throws PostProcessException {
        List<String> postProcessed = new ArrayList<>();
        if (!config.postProcess()) {
            return postProcessed;
        }
        Optional<PostProcessor> postProcessor = storage.postProcessor();
        if (postProcessor.isEmpty()) {
            return postProcessed;
        }

        state = CollectionState.POST_PROCESSING;
        for (PostProcessResult result : postProcessor.get().postProcess(modifiedFiles, config.dryRun())) {
            String original = result.getOriginalPath();
            if (result.isFailure()) {
                LOGGER.error("Post-processing '{}' failed!", original);
                // Blank line keeps the path visible above the stack trace.
                LOGGER.error("");
                Exception cause = result.getError()
                        .orElseGet(() -> new IOException("Post-processing reported a failure"));
                throw new PostProcessException(original, cause);
            }
            if (result.getOutcome() == PostProcessResult.Outcome.PROCESSED) {
                LOGGER.info("Post-processed '{}' as '{}'", original, result.getProcessedPath().orElse(original));
                postProcessed.add(original);
            } else {
                LOGGER.info("Skipped post-processing '{}'", original);
            }
        }
        return postProcessed;
    }
}
