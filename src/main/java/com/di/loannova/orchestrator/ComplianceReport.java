package com.di.loannova.orchestrator;

import com.di.loannova.transform.AccessLogEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Compliance artifact of a run, written as {@code {run}/{run}_compliance.json}: which columns were
 * masked at which stage, and who touched the data.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComplianceReport(String runId,
                               Instant generatedAt,
                               String maskStage,
                               List<String> piiMaskedColumns,
                               List<AccessLogEntry> accessLog,
                               Map<String, Object> metadata) {

    public static final String FILE_SUFFIX = "_compliance.json";
}
