package com.example.collectfaster;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransferExecutorTest {
    private static final TestSource SOURCE = new TestSource("assets");

    @Test
    void dispatchesOnOperation() throws Exception {
        InMemoryStorage storage = new InMemoryStorage();
        TransferExecutor executor = new TransferExecutor(storage);

        executor.execute(TransferTask.copy("a.css", "static/a.css", SOURCE));
        executor.execute(TransferTask.link("b.js", "static/b.js", SOURCE));

        assertEquals("assets:a.css", storage.content("static/a.css").orElseThrow());
        assertFalse(storage.isLink("static/a.css"));
        assertTrue(storage.isLink("static/b.js"));
    }

    @Test
    void wrapsBackendFailureWithTheTask() {
        InMemoryStorage storage = new InMemoryStorage().failOn("a.css"::equals);
        TransferExecutor executor = new TransferExecutor(storage);
        TransferTask task = TransferTask.copy("a.css", "static/a.css", SOURCE);

        TransferException error = assertThrows(TransferException.class, () -> executor.execute(task));

        assertSame(task, error.getTask());
        assertEquals("static/a.css", error.getDestinationPath());
        assertTrue(error.getMessage().contains("static/a.css"));
        assertEquals(1, storage.transferCount("static/a.css"));
    }

    @Test
    void dryRunLeavesStorageUntouched() throws Exception {
        InMemoryStorage storage = new InMemoryStorage();
        TransferExecutor executor = new TransferExecutor(storage, true);

        executor.execute(TransferTask.copy("a.css", "static/a.css", SOURCE));

        assertEquals(0, storage.transferCount("static/a.css"));
        assertTrue(storage.content("static/a.css").isEmpty());
    }

    @Test
    void failureMessageIgnoresTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            TransferException error = new TransferException(
                    TransferTask.link("b.js", "static/b.js", SOURCE), new IOException("denied"));

            assertEquals("Failed to link 'b.js' to 'static/b.js': denied", error.getMessage());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
