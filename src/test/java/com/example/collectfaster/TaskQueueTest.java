package com.example.collectfaster;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskQueueTest {
    private static final TestSource SOURCE = new TestSource("assets");

    @Test
    void returnsTasksInInsertionOrder() {
        TaskQueue queue = new TaskQueue();
        queue.put(TransferTask.copy("a.css", "static/a.css", SOURCE));
        queue.put(TransferTask.copy("b.js", "static/b.js", SOURCE));

        assertEquals("static/a.css", queue.tryTake().orElseThrow().destinationPath());
        assertEquals("static/b.js", queue.tryTake().orElseThrow().destinationPath());
        assertTrue(queue.tryTake().isEmpty());
        assertTrue(queue.isEmpty());
    }

    @Test
    void rejectsNullTasks() {
        assertThrows(IllegalArgumentException.class, () -> new TaskQueue().put(null));
    }

    @Test
    void concurrentTakersReceiveEveryTaskExactlyOnce() throws Exception {
        int taskCount = 10_000;
        int takers = 8;
        TaskQueue queue = new TaskQueue();
        for (int i = 0; i < taskCount; i++) {
            queue.put(TransferTask.copy("file" + i, "static/file" + i, SOURCE));
        }

        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger taken = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < takers; t++) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
                Optional<TransferTask> next = queue.tryTake();
                while (next.isPresent()) {
                    seen.add(next.get().destinationPath());
                    taken.incrementAndGet();
                    next = queue.tryTake();
                }
            });
            thread.start();
            threads.add(thread);
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(taskCount, taken.get());
        assertEquals(taskCount, seen.size());
        assertTrue(queue.isEmpty());
    }
}
