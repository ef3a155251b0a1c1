package com.example.collectfaster;

import com.example.collectfaster.storage.FileSystemStorage;
import com.example.collectfaster.storage.S3Storage;
import com.example.collectfaster.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "collectfaster",
        mixinStandardHelpOptions = true,
        description = "Collects static files into a single destination, optionally in parallel.")
public final class App implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    @Parameters(index = "0", paramLabel = "CONFIG", description = "JSON configuration file.")
    Path configPath;

    @Option(names = "--faster", description = "Collect static files simultaneously.")
    boolean faster;

    @Option(names = "--workers", paramLabel = "N",
            description = "Amount of simultaneous workers (default=" + WorkerPool.DEFAULT_WORKERS + ").")
    Integer workers;

    @Option(names = "--use-multiprocessing",
            description = "Run every worker on a dedicated thread instead of a shared pool.")
    boolean useMultiprocessing;

    @Option(names = {"-l", "--link"}, description = "Create a symbolic link to each file instead of copying.")
    boolean link;

    @Option(names = {"-n", "--dry-run"}, description = "Do everything except modify the destination.")
    boolean dryRun;

    @Option(names = "--no-post-process", description = "Do NOT post-process collected files.")
    boolean noPostProcess;

    @Option(names = {"-i", "--ignore"}, paramLabel = "PATTERN",
            description = "Ignore files or directories matching this glob-style pattern. Repeatable.")
    List<String> ignorePatterns = new ArrayList<>();

    public static void main(String[] args) {
        System.exit(new CommandLine(new App()).execute(args));
    }

    @Override
    public Integer call() throws InterruptedException {
        CollectConfig config;
        try {
            config = new ConfigLoader().load(configPath, this::applyOverrides);
        } catch (ConfigurationException ex) {
            LOGGER.error("Invalid configuration in {}: {}", configPath, ex.getMessage());
            return 1;
        } catch (IOException ex) {
            LOGGER.error("Failed to read configuration {}", configPath, ex);
            return 1;
        }

        StorageBackend storage = createStorage(config.destination());
        try {
            Finder finder = new FileSystemFinder(config.sources(), config.ignorePatterns());
            CollectionSummary summary = new CollectionCoordinator(config, finder, storage).collect();
            LOGGER.info(summary.describe());
            return 0;
        } catch (ConfigurationException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return 1;
        } catch (TransferException ex) {
            LOGGER.error("'{}' could not be collected", ex.getDestinationPath(), ex);
            return 1;
        } catch (PostProcessException ex) {
            LOGGER.error("'{}' could not be post-processed", ex.getOriginalPath(), ex);
            return 1;
        } catch (IOException ex) {
            LOGGER.error("Collection failed", ex);
            return 1;
        } finally {
            if (storage instanceof S3Storage) {
                ((S3Storage) storage).close();
            }
        }
    }

    void applyOverrides(ConfigLoader.RawConfig raw) {
        if (faster) {
            raw.faster = true;
        }
        if (workers != null) {
            raw.workers = workers;
        }
        if (useMultiprocessing) {
            raw.useMultiprocessing = true;
        }
        if (link) {
            raw.link = true;
        }
        if (dryRun) {
            raw.dryRun = true;
        }
        if (noPostProcess) {
            raw.postProcess = false;
        }
        if (!ignorePatterns.isEmpty()) {
            List<String> merged = raw.ignorePatterns == null ? new ArrayList<>() : new ArrayList<>(raw.ignorePatterns);
            merged.addAll(ignorePatterns);
            raw.ignorePatterns = merged;
        }
    }

    static StorageBackend createStorage(CollectConfig.Destination destination) {
        switch (destination.type()) {
            case S3:
                return new S3Storage(
                        destination.bucket().orElseThrow(),
                        destination.location(),
                        destination.region(),
                        destination.hashedNames()
                );
            case LOCAL:
            default:
                return new FileSystemStorage(destination.root().orElseThrow(), destination.hashedNames());
        }
    }
}
