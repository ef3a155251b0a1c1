package com.example.collectfaster;

/**
 * Post-processing reported a failure for one file. Always aborts the run.
 */
public class PostProcessException extends Exception {
    private final String originalPath;

    public PostProcessException(String originalPath, Throwable cause) {
        super("Post-processing '" + originalPath + "' failed: " + cause.getMessage(), cause);
        this.originalPath = originalPath;
    }

    public String getOriginalPath() {
        return originalPath;
    }
}
