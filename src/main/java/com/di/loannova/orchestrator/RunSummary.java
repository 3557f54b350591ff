package com.di.loannova.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run, written as {@code {run}/run_summary.json} and {@code latest.json}, and
 * returned by the trigger endpoint.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunSummary {

    String              runId;
    RunStatus           status;
    /** Machine-readable reason for anything but success. */
    String              reason;
    String              error;
    String              errorCategory;
    Instant             startedAt;
    Instant             completedAt;
    Map<String, Object> input;
    Map<String, Object> phases;
    Map<String, Double> metrics;
    List<String>        alerts;
    QualityGateResult   quality;
    Map<String, Object> schemaDiff;
    String              manifest;
}
