package com.example.collectfaster;

import com.example.collectfaster.storage.LocalSourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds static files in the configured source directories.
 */
public final class FileSystemFinder implements Finder {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemFinder.class);

    private final List<CollectConfig.Source> sources;
    private final List<PathMatcher> ignoreMatchers;

    public FileSystemFinder(List<CollectConfig.Source> sources, List<String> ignorePatterns) {
        this.sources = List.copyOf(sources);
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : ignorePatterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        this.ignoreMatchers = List.copyOf(matchers);
    }

    @Override
    public Stream<FoundFile> list() throws IOException {
        for (CollectConfig.Source source : sources) {
            if (!Files.isDirectory(source.path())) {
                throw new IOException("Source directory does not exist: " + source.path());
            }
        }
        return sources.stream().flatMap(this::listSource);
    }

    private Stream<FoundFile> listSource(CollectConfig.Source source) {
        LocalSourceLocation location = new LocalSourceLocation(source.path());
        Path root = location.root();
        Stream<Path> walk;
        try {
            walk = Files.walk(root);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + root, ex);
        }
        return walk
                .filter(Files::isRegularFile)
                .filter(path -> !isIgnored(root, path))
                .sorted()
                .map(path -> {
                    String relative = toUnixPath(root.relativize(path));
                    return new FoundFile(relative, destinationFor(source, relative), location);
                });
    }

    private boolean isIgnored(Path root, Path file) {
        // Any ignored name along the relative path excludes the file, so ignored directories are skipped too.
        for (Path part : root.relativize(file)) {
            for (PathMatcher matcher : ignoreMatchers) {
                if (matcher.matches(part)) {
                    LOGGER.debug("Ignoring {}", file);
                    return true;
                }
            }
        }
        return false;
    }

    private String destinationFor(CollectConfig.Source source, String relative) {
        return source.prefix()
                .map(prefix -> prefix + "/" + relative)
                .orElse(relative);
    }

    private String toUnixPath(Path path) {
        return path.toString().replace("\\", "/");
    }
}
