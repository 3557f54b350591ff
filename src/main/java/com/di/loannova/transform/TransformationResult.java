package com.di.loannova.transform;

import com.di.loannova.common.Dataset;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of the transformation phase.
 *
 * @param dataset        normalized, masked rows with {@code _tx_run_id} and {@code _tx_timestamp} appended
 * @param runId          transformation sub-run id ({@code tx_...})
 * @param maskedColumns  columns whose values were masked or redacted
 * @param accessLog      compliance touches in order
 * @param qualityChecks  {@code {column}_{check}} to pass/fail
 * @param lineage        recorded steps, including input and output content hashes
 * @param outliers       z-score flags per column
 * @param inputHash      content hash of the dataset received
 * @param outputHash     content hash after masking, before the audit columns are added
 * @param timestamp      completion time
 */
public record TransformationResult(Dataset dataset,
                                   String runId,
                                   Set<String> maskedColumns,
                                   List<AccessLogEntry> accessLog,
                                   Map<String, Boolean> qualityChecks,
                                   List<LineageEvent> lineage,
                                   Map<String, OutlierDetector.Flag> outliers,
                                   String inputHash,
                                   String outputHash,
                                   Instant timestamp) {

    public TransformationResult {
        maskedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(maskedColumns));
        accessLog = List.copyOf(accessLog);
        qualityChecks = Collections.unmodifiableMap(new LinkedHashMap<>(qualityChecks));
        lineage = List.copyOf(lineage);
        outliers = Collections.unmodifiableMap(new LinkedHashMap<>(outliers));
    }
}
