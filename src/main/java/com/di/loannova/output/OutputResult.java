package com.di.loannova.output;

import java.nio.file.Path;
import java.util.Map;

/**
 * Outcome of the output phase. A skipped result points at the existing manifest of the
 * content-identical earlier run and carries no new files.
 */
public record OutputResult(String runId,
                           boolean skipped,
                           Manifest manifest,
                           Path manifestPath,
                           Map<String, String> files) {

    public static OutputResult skipped(String runId, Path existingManifest) {
        return new OutputResult(runId, true, null, existingManifest, Map.of());
    }
}
