package com.example.collectfaster;

import com.example.collectfaster.storage.S3Storage;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

public class ConfigLoader {
    private static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            "CVS",
            ".*",
            "*~"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CollectConfig load(Path path) throws IOException {
        return load(path, raw -> {
        });
    }

    /**
     * Reads the JSON config at {@code path}, lets {@code overrides} adjust the raw values
     * (command line flags win over the file), then validates the result.
     */
    public CollectConfig load(Path path, Consumer<RawConfig> overrides) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        overrides.accept(raw);
        Path baseDirectory = path.toAbsolutePath().getParent();
        return validate(raw, baseDirectory);
    }

    CollectConfig validate(RawConfig raw, Path baseDirectory) {
        if (raw.sources == null || raw.sources.isEmpty()) {
            throw new ConfigurationException("Config must include at least one source directory.");
        }
        List<CollectConfig.Source> sources = new ArrayList<>();
        for (RawSource source : raw.sources) {
            if (source == null || source.path == null || source.path.isBlank()) {
                throw new ConfigurationException("Every source must have a path.");
            }
            Optional<String> prefix = Optional.ofNullable(source.prefix)
                    .map(value -> value.replaceAll("^/+", "").replaceAll("/+$", ""))
                    .filter(value -> !value.isBlank());
            sources.add(new CollectConfig.Source(resolve(baseDirectory, source.path), prefix));
        }

        int workers = raw.workers == null ? WorkerPool.DEFAULT_WORKERS : raw.workers;
        if (workers <= 0) {
            throw new ConfigurationException("workers must be a positive number, got " + workers + ".");
        }
        boolean faster = Boolean.TRUE.equals(raw.faster);
        boolean useMultiprocessing = Boolean.TRUE.equals(raw.useMultiprocessing);
        if (useMultiprocessing && !faster) {
            throw new ConfigurationException("useMultiprocessing only applies together with faster.");
        }
        boolean link = Boolean.TRUE.equals(raw.link);
        boolean dryRun = Boolean.TRUE.equals(raw.dryRun);
        boolean postProcess = raw.postProcess == null || raw.postProcess;

        CollectConfig.Destination destination = destination(raw.destination, baseDirectory);
        if (link && destination.type() != CollectConfig.DestinationType.LOCAL) {
            throw new ConfigurationException("Can't symlink to a remote destination.");
        }

        return new CollectConfig(
                sources,
                mergePatterns(DEFAULT_IGNORE_PATTERNS, raw.ignorePatterns),
                destination,
                faster,
                workers,
                useMultiprocessing,
                link,
                dryRun,
                postProcess
        );
    }

    private CollectConfig.Destination destination(RawDestination raw, Path baseDirectory) {
        if (raw == null) {
            throw new ConfigurationException("Config must include a destination.");
        }
        String type = optionalString(raw.type, "local").toLowerCase(Locale.ROOT);
        boolean hashedNames = "hashed".equalsIgnoreCase(optionalString(raw.postProcessor, "none"));
        switch (type) {
            case "local":
                if (raw.root == null || raw.root.isBlank()) {
                    throw new ConfigurationException("destination.root is required for a local destination.");
                }
                return CollectConfig.Destination.local(resolve(baseDirectory, raw.root), hashedNames);
            case "s3":
                Optional<String> bucket = Optional.ofNullable(raw.bucket).filter(value -> !value.isBlank());
                if (bucket.isEmpty()) {
                    throw new ConfigurationException("destination.bucket is required for an s3 destination.");
                }
                return new CollectConfig.Destination(
                        CollectConfig.DestinationType.S3,
                        Optional.empty(),
                        bucket,
                        optionalString(raw.location, S3Storage.DEFAULT_LOCATION),
                        Optional.ofNullable(raw.region).filter(value -> !value.isBlank()),
                        hashedNames
                );
            default:
                throw new ConfigurationException("Unknown destination type '" + raw.type + "'.");
        }
    }

    private Path resolve(Path baseDirectory, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDirectory == null) {
            return path;
        }
        return baseDirectory.resolve(path).normalize();
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    static class RawConfig {
        public List<RawSource> sources = new ArrayList<>();
        public List<String> ignorePatterns;
        public RawDestination destination;
        public Boolean faster;
        public Integer workers;
        public Boolean useMultiprocessing;
        public Boolean link;
        public Boolean dryRun;
        public Boolean postProcess;
    }

    static class RawSource {
        public String path;
        public String prefix;
    }

    static class RawDestination {
        public String type;
        public String root;
        public String bucket;
        public String location;
        public String region;
        public String postProcessor;
    }
}
