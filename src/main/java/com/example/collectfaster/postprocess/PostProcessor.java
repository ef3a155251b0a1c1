package com.example.collectfaster.postprocess;

import com.example.collectfaster.ModifiedFileRecord;

import java.util.List;

/**
 * Transformation applied by a storage to the files changed during a run.
 */
@FunctionalInterface
public interface PostProcessor {
    /**
     * Processes the recorded files in record order. Implementations stop at the first
     * failure, so a failed result, if present, is always the last one.
     */
    List<PostProcessResult> postProcess(ModifiedFileRecord modifiedFiles, boolean dryRun);
}
