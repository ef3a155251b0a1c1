package com.example.collectfaster.postprocess;

import java.util.Map;

/**
 * Serialized mapping from original paths to their hashed names.
 */
public record Manifest(
        String version,
        Map<String, String> paths
) {
    public static final String CURRENT_VERSION = "1.0";
}
