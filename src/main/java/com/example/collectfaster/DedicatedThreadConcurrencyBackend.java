package com.example.collectfaster;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs each worker on its own platform thread. Selected by {@code --use-multiprocessing}.
 */
public final class DedicatedThreadConcurrencyBackend implements ConcurrencyBackend {

    @Override
    public JoinHandle spawn(int workerCount, Worker worker) {
        List<Thread> threads = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            int index = i;
            Thread thread = new Thread(() -> worker.run(index), "transfer-worker-" + (i + 1));
            thread.start();
            threads.add(thread);
        }
        return () -> {
            for (Thread thread : threads) {
                thread.join();
            }
        };
    }
}
