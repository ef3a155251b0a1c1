package com.example.collectfaster;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileSystemFinderTest {
    @Test
    void listsFilesWithPrefixedDestinations() throws Exception {
        Path root = Files.createTempDirectory("finder-root");
        Files.createDirectories(root.resolve("css"));
        Files.writeString(root.resolve("css/site.css"), "body {}");
        Files.writeString(root.resolve("app.js"), "run();");

        FileSystemFinder finder = new FileSystemFinder(
                List.of(new CollectConfig.Source(root, Optional.of("static"))), List.of());

        List<FoundFile> files;
        try (Stream<FoundFile> stream = finder.list()) {
            files = stream.toList();
        }

        assertEquals(2, files.size());
        assertEquals("app.js", files.get(0).sourcePath());
        assertEquals("static/app.js", files.get(0).destinationPath());
        assertEquals("css/site.css", files.get(1).sourcePath());
        assertEquals("static/css/site.css", files.get(1).destinationPath());
        assertEquals(root.resolve("css/site.css").toAbsolutePath().normalize(),
                files.get(1).sourceLocation().resolve("css/site.css"));
    }

    @Test
    void skipsIgnoredFilesAndDirectories() throws Exception {
        Path root = Files.createTempDirectory("finder-ignore");
        Files.createDirectories(root.resolve(".git"));
        Files.createDirectories(root.resolve("CVS"));
        Files.writeString(root.resolve(".git/config"), "[core]");
        Files.writeString(root.resolve("CVS/Entries"), "");
        Files.writeString(root.resolve("site.css~"), "backup");
        Files.writeString(root.resolve("site.css.map"), "{}");
        Files.writeString(root.resolve("site.css"), "body {}");

        FileSystemFinder finder = new FileSystemFinder(
                List.of(new CollectConfig.Source(root, Optional.empty())),
                List.of("CVS", ".*", "*~", "*.map"));

        List<String> destinations;
        try (Stream<FoundFile> stream = finder.list()) {
            destinations = stream.map(FoundFile::destinationPath).toList();
        }

        assertEquals(List.of("site.css"), destinations);
    }

    @Test
    void yieldsSameDestinationFromSeveralSourcesInOrder() throws Exception {
        Path app = Files.createTempDirectory("finder-app");
        Path vendor = Files.createTempDirectory("finder-vendor");
        Files.writeString(app.resolve("reset.css"), "app");
        Files.writeString(vendor.resolve("reset.css"), "vendor");

        FileSystemFinder finder = new FileSystemFinder(List.of(
                new CollectConfig.Source(app, Optional.empty()),
                new CollectConfig.Source(vendor, Optional.empty())), List.of());

        List<FoundFile> files;
        try (Stream<FoundFile> stream = finder.list()) {
            files = stream.toList();
        }

        assertEquals(2, files.size());
        assertEquals(files.get(0).destinationPath(), files.get(1).destinationPath());
        assertEquals(app.toAbsolutePath().normalize().toString(), files.get(0).sourceLocation().name());
        assertEquals(vendor.toAbsolutePath().normalize().toString(), files.get(1).sourceLocation().name());
    }

    @Test
    void failsForMissingSourceDirectory() {
        FileSystemFinder finder = new FileSystemFinder(
                List.of(new CollectConfig.Source(Path.of("does-not-exist-" + System.nanoTime()), Optional.empty())),
                List.of());

        assertThrows(IOException.class, finder::list);
    }
}
