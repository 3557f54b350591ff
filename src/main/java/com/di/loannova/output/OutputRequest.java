package com.di.loannova.output;

import com.di.loannova.calculation.CalculationResult;
import com.di.loannova.common.Dataset;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything the output phase persists for one run.
 *
 * @param subRuns          phase name to sub-run id
 * @param complianceReport path of the already written compliance report, or {@code null}
 * @param force            write even when a manifest for the same source hash exists
 */
public record OutputRequest(String runId,
                            String sourceHash,
                            Dataset dataset,
                            CalculationResult calculation,
                            Map<String, Object> metadata,
                            Map<String, String> subRuns,
                            Map<String, Boolean> qualityChecks,
                            Path complianceReport,
                            boolean force) {
}
