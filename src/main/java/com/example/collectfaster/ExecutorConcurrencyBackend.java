package com.example.collectfaster;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs workers on a fixed thread pool sized to the worker count.
 */
public final class ExecutorConcurrencyBackend implements ConcurrencyBackend {

    @Override
    public JoinHandle spawn(int workerCount, Worker worker) {
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, new NamedThreadFactory("transfer-pool-"));
        for (int i = 0; i < workerCount; i++) {
            int index = i;
            executor.execute(() -> worker.run(index));
        }
        executor.shutdown();
        return () -> {
            while (!executor.awaitTermination(1, TimeUnit.HOURS)) {
                // keep waiting, the caller must not move on before every worker exits
            }
        };
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
