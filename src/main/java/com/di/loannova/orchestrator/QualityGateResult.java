package com.di.loannova.orchestrator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Payload of {@code {run}/quality.json}.
 *
 * @param completeness    share of non-missing required cells, in [0, 1]
 * @param freshnessHours  hours between the latest measurement date and the evaluation time
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityGateResult(String runId,
                                double completeness,
                                double freshnessHours,
                                boolean referentialIntegrityPass,
                                boolean passed,
                                Map<String, Object> notes) {
}
