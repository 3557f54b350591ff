package com.di.loannova.orchestrator;

/**
 * Per-invocation overrides of the configured run settings; {@code null} fields fall back to
 * {@code loannova.pipeline.run.*}.
 */
public record RunRequest(Boolean force, String user, String action) {

    public static RunRequest defaults() {
        return new RunRequest(null, null, null);
    }
}
