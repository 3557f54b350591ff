package com.di.loannova.output;

import com.di.loannova.calculation.AnomalyFlag;
import com.di.loannova.calculation.MetricResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable record of one run, written as {@code {artifacts-dir}/{run}/{run}_manifest.json}.
 *
 * <p>Written once by the output phase and rewritten only to attach {@code cloud_blobs} after
 * export. The {@code source_hash} is what later runs compare against to detect a rerun of
 * identical input, but only once {@code status} is {@code complete}: a manifest left in
 * {@code exporting} by a failed cloud export stays on disk for diagnosis and does not block a rerun.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Manifest {

    public static final String STATUS_EXPORTING = "exporting";
    public static final String STATUS_COMPLETE  = "complete";

    private String                    runId;
    private Map<String, String>       subRuns;
    private Instant                   generatedAt;
    private String                    sourceHash;
    /** {@code exporting} until the cloud export has finished, then {@code complete}. */
    private String                    status;

    private Map<String, MetricResult> metrics;
    private List<AnomalyFlag>         anomalies;
    private Map<String, Object>       metadata;
    private Map<String, Boolean>      qualityChecks;

    /** Format to local path of each data artifact. */
    private Map<String, String>       files;
    /** Artifact key to SHA-256 of the file content. */
    private Map<String, String>       fileHashes;
    /** Rollup to local path of each timeseries CSV. */
    private Map<String, String>       timeseries;
    private String                    complianceReport;

    /** File name to object URL; present only after a cloud export. */
    private Map<String, String>       cloudBlobs;
}
