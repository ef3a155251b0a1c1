package com.example.collectfaster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Drains a {@link TaskQueue} with a fixed number of concurrent workers.
 * <p>
 * A failing task never stops the other workers: every failure is collected and
 * handed back once all workers have exited, so no queued task is left unattempted
 * without a signal.
 */
public final class WorkerPool {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);
    public static final int DEFAULT_WORKERS = 20;

    private final ConcurrencyBackend concurrencyBackend;

    public WorkerPool(ConcurrencyBackend concurrencyBackend) {
        this.concurrencyBackend = concurrencyBackend;
    }

    /**
     * Runs {@code workerCount} workers until the queue is empty and returns after all of
     * them have terminated.
     */
    public TransferReport run(TaskQueue queue, TransferExecutor executor, int workerCount) throws InterruptedException {
        return run(queue, executor, workerCount, task -> true);
    }

    /**
     * Like {@link #run(TaskQueue, TransferExecutor, int)}, but a task rejected by
     * {@code current} counts as attempted without being applied. Used to drop tasks whose
     * destination was claimed by a later source.
     */
    public TransferReport run(TaskQueue queue,
                              TransferExecutor executor,
                              int workerCount,
                              Predicate<TransferTask> current) throws InterruptedException {
        if (workerCount <= 0) {
            throw new ConfigurationException("Worker count must be positive, got " + workerCount);
        }
        AtomicInteger attempted = new AtomicInteger();
        Queue<TransferFailure> failures = new ConcurrentLinkedQueue<>();

        LOGGER.debug("Starting {} workers for {} queued tasks", workerCount, queue.size());
        ConcurrencyBackend.JoinHandle handle = concurrencyBackend.spawn(workerCount,
                index -> drain(index, queue, executor, current, attempted, failures));
        handle.join();

        return new TransferReport(attempted.get(), new ArrayList<>(failures));
    }

    private void drain(int index,
                       TaskQueue queue,
                       TransferExecutor executor,
                       Predicate<TransferTask> current,
                       AtomicInteger attempted,
                       Queue<TransferFailure> failures) {
        String workerName = Thread.currentThread().getName();
        int processed = 0;
        Optional<TransferTask> next = queue.tryTake();
        while (next.isPresent()) {
            TransferTask task = next.get();
            attempted.incrementAndGet();
            processed++;
            try {
                if (current.test(task)) {
                    executor.execute(task);
                } else {
                    LOGGER.debug("Skipping '{}', superseded by a later source", task.destinationPath());
                }
            } catch (TransferException ex) {
                failures.add(new TransferFailure(task, workerName, Instant.now(), ex));
            } catch (RuntimeException | Error ex) {
                // Anything else still belongs to this task; the worker keeps draining.
                failures.add(new TransferFailure(task, workerName, Instant.now(), new TransferException(task, ex)));
            }
            next = queue.tryTake();
        }
        LOGGER.debug("Worker {} ({}) finished after {} tasks", index, workerName, processed);
    }
}
