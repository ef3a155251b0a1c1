package com.example.collectfaster.postprocess;

import com.example.collectfaster.ModifiedFileRecord;
import com.example.collectfaster.storage.StorageBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores a copy of each changed file under a content-hashed name, such as
 * {@code css/site.5d41402abc4b.css}, and records the mapping in a JSON manifest.
 */
public final class HashedNamePostProcessor implements PostProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(HashedNamePostProcessor.class);
    public static final String MANIFEST_NAME = "staticfiles.json";
    private static final int HASH_LENGTH = 12;

    private final StorageBackend storage;
    private final ObjectMapper mapper = new ObjectMapper();

    public HashedNamePostProcessor(StorageBackend storage) {
        this.storage = storage;
    }

    @Override
    public List<PostProcessResult> postProcess(ModifiedFileRecord modifiedFiles, boolean dryRun) {
        List<PostProcessResult> results = new ArrayList<>();
        if (dryRun) {
            modifiedFiles.destinationPaths().forEach(path -> results.add(PostProcessResult.skipped(path)));
            return results;
        }

        Map<String, String> hashedPaths = new LinkedHashMap<>();
        for (String path : modifiedFiles.destinationPaths()) {
            try {
                byte[] content;
                try (InputStream in = storage.open(path)) {
                    content = in.readAllBytes();
                }
                String hashedPath = hashedName(path, computeMd5(content));
                hashedPaths.put(path, hashedPath);
                if (storage.exists(hashedPath)) {
                    results.add(PostProcessResult.skipped(path));
                    continue;
                }
                storage.write(hashedPath, content);
                results.add(PostProcessResult.processed(path, hashedPath));
            } catch (IOException ex) {
                results.add(PostProcessResult.failed(path, ex));
                return results;
            }
        }

        try {
            storage.write(MANIFEST_NAME, mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new Manifest(Manifest.CURRENT_VERSION, hashedPaths)));
        } catch (IOException ex) {
            LOGGER.warn("Failed to write {} to {}", MANIFEST_NAME, storage.describe(), ex);
            results.add(PostProcessResult.failed(MANIFEST_NAME, ex));
        }
        return results;
    }

    /**
     * Inserts the hash before the file extension: {@code a/b.css} becomes {@code a/b.<hash>.css}.
     */
    static String hashedName(String path, String hash) {
        String shortHash = hash.substring(0, HASH_LENGTH);
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return path + "." + shortHash;
        }
        return path.substring(0, dot) + "." + shortHash + path.substring(dot);
    }

    private static String computeMd5(byte[] content) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
        byte[] hash = digest.digest(content);
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
