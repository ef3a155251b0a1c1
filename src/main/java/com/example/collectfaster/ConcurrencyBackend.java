package com.example.collectfaster;

/**
 * Starts a fixed number of concurrent workers running the same loop.
 */
public interface ConcurrencyBackend {
    /**
     * Starts {@code workerCount} workers. Each receives its zero-based index.
     */
    JoinHandle spawn(int workerCount, Worker worker);

    @FunctionalInterface
    interface Worker {
        void run(int workerIndex);
    }

    @FunctionalInterface
    interface JoinHandle {
        /**
         * Blocks until every spawned worker has returned.
         */
        void join() throws InterruptedException;
    }
}
