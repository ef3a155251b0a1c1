package com.example.collectfaster.storage;

import com.example.collectfaster.postprocess.HashedNamePostProcessor;
import com.example.collectfaster.postprocess.PostProcessor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores collected files below a root directory on the local filesystem.
 * <p>
 * Copies and links are staged under a unique sibling name and renamed into place, so
 * concurrent transfers to the same destination each replace it whole.
 */
public final class FileSystemStorage implements StorageBackend {
    private final Path root;
    private final boolean hashedNames;

    public FileSystemStorage(Path root) {
        this(root, false);
    }

    public FileSystemStorage(Path root, boolean hashedNames) {
        this.root = root.toAbsolutePath().normalize();
        this.hashedNames = hashedNames;
    }

    public Path root() {
        return root;
    }

    @Override
    public String describe() {
        return root.toString();
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path), LinkOption.NOFOLLOW_LINKS);
    }

    @Override
    public Optional<Instant> modifiedTime(String path) throws IOException {
        Path target = resolve(path);
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        return Optional.of(Files.getLastModifiedTime(target, LinkOption.NOFOLLOW_LINKS).toInstant());
    }

    @Override
    public boolean isLink(String path) {
        return Files.isSymbolicLink(resolve(path));
    }

    @Override
    public void copy(String sourcePath, String destinationPath, SourceLocation source) throws IOException {
        Path target = prepareTarget(destinationPath);
        Path staged = stagingPath(target);
        try {
            Files.copy(source.resolve(sourcePath), staged);
            moveIntoPlace(staged, target);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    @Override
    public void link(String sourcePath, String destinationPath, SourceLocation source) throws IOException {
        Path target = prepareTarget(destinationPath);
        Path linkTarget = source.resolve(sourcePath).toAbsolutePath();
        if (!Files.exists(linkTarget)) {
            throw new NoSuchFileException(linkTarget.toString());
        }
        // Parallel runs skip the stale check, so an existing file or link is replaced here.
        Path staged = stagingPath(target);
        try {
            Files.createSymbolicLink(staged, linkTarget);
            moveIntoPlace(staged, target);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    @Override
    public void delete(String path) throws IOException {
        Files.deleteIfExists(resolve(path));
    }

    @Override
    public InputStream open(String path) throws IOException {
        return Files.newInputStream(resolve(path));
    }

    @Override
    public void write(String path, byte[] content) throws IOException {
        Files.write(prepareTarget(path), content);
    }

    @Override
    public Optional<PostProcessor> postProcessor() {
        return hashedNames ? Optional.of(new HashedNamePostProcessor(this)) : Optional.empty();
    }

    private Path prepareTarget(String path) throws IOException {
        Path target = resolve(path);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return target;
    }

    private static Path stagingPath(Path target) {
        return target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    private static void moveIntoPlace(Path staged, Path target) throws IOException {
        Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + path);
        }
        return resolved;
    }
}
