package com.example.collectfaster.postprocess;

import java.util.Optional;

public final class PostProcessResult {
    public enum Outcome {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    private final String originalPath;
    private final String processedPath;
    private final Outcome outcome;
    private final Exception error;

    private PostProcessResult(String originalPath, String processedPath, Outcome outcome, Exception error) {
        this.originalPath = originalPath;
        this.processedPath = processedPath;
        this.outcome = outcome;
        this.error = error;
    }

    public static PostProcessResult processed(String originalPath, String processedPath) {
        return new PostProcessResult(originalPath, processedPath, Outcome.PROCESSED, null);
    }

    public static PostProcessResult skipped(String originalPath) {
        return new PostProcessResult(originalPath, null, Outcome.SKIPPED, null);
    }

    public static PostProcessResult failed(String originalPath, Exception error) {
        return new PostProcessResult(originalPath, null, Outcome.FAILED, error);
    }

    public String getOriginalPath() {
        return originalPath;
    }

    public Optional<String> getProcessedPath() {
        return Optional.ofNullable(processedPath);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILED;
    }

    @Override
    public String toString() {
        return outcome + "(" + originalPath + (processedPath == null ? "" : " -> " + processedPath) + ")";
    }
}
