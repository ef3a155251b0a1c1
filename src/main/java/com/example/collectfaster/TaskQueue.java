package com.example.collectfaster;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Unbounded FIFO of transfer tasks shared by the worker pool.
 * All tasks are put before the workers start, so consumers poll until empty
 * instead of waiting for new work.
 */
public final class TaskQueue {
    private final Queue<TransferTask> tasks = new ConcurrentLinkedQueue<>();

    public void put(TransferTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        tasks.offer(task);
    }

    /**
     * Removes and returns the head of the queue, or empty if nothing is left.
     * Each task is handed to at most one caller.
     */
    public Optional<TransferTask> tryTake() {
        return Optional.ofNullable(tasks.poll());
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }
}
