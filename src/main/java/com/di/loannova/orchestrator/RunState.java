package com.di.loannova.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content of the run-state file: last processed raw hash per source key.
 *
 * @param rawHashes source key ({@code {type}:{file name}}) to SHA-256 of the last published input
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunState(Map<String, String> rawHashes, String lastRunId, Instant updatedAt) {

    public RunState {
        rawHashes = rawHashes == null ? Map.of() : Map.copyOf(rawHashes);
    }

    public static RunState empty() {
        return new RunState(Map.of(), null, null);
    }

    public boolean matches(String sourceKey, String sha256) {
        return sha256 != null && sha256.equals(rawHashes.get(sourceKey));
    }

    public RunState record(String sourceKey, String sha256, String runId, Instant at) {
        Map<String, String> hashes = new LinkedHashMap<>(rawHashes);
        hashes.put(sourceKey, sha256);
        return new RunState(hashes, runId, at);
    }
}
