package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.contract.Violation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the ingestion phase.
 *
 * @param dataset       validated, canonical, de-duplicated rows
 * @param runId         ingestion sub-run id ({@code ingest_...})
 * @param sourceHash    SHA-256 of the raw extract
 * @param metadata      checksum, row_count, error_count, validation_errors, deduped_count, column_resolution, ...
 * @param qualityReport scored data-quality audit
 * @param violations    non-critical contract violations carried forward (empty under strict mode)
 */
public record IngestionResult(Dataset dataset,
                              String runId,
                              String sourceHash,
                              Map<String, Object> metadata,
                              DataQualityReport qualityReport,
                              List<Violation> violations) {

    public IngestionResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        violations = List.copyOf(violations);
    }
}
