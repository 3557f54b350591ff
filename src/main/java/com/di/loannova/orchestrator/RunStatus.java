package com.di.loannova.orchestrator;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Terminal status of a pipeline run. */
public enum RunStatus {
    SUCCESS,
    /** Identical input was already processed; nothing was written except {@code latest.json}. */
    SKIPPED,
    SCHEMA_DRIFT,
    FAILED,
    QUALITY_GATE_FAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
