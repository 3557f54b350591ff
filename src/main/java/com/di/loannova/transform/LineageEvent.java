package com.di.loannova.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded transformation step.
 */
public record LineageEvent(@JsonProperty("run_id") String runId,
                           String step,
                           String status,
                           Instant timestamp,
                           Map<String, Object> details) {

    public LineageEvent {
        details = Map.copyOf(details);
    }
}
