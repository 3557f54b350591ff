package com.di.loannova.calculation;

import com.di.loannova.common.Dataset;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the calculation phase.
 *
 * @param metrics    one entry per attempted KPI, in catalogue order
 * @param timeseries rollup code to per-period KPI table
 */
public record CalculationResult(String runId,
                                Map<String, MetricResult> metrics,
                                List<AuditEvent> auditTrail,
                                List<AnomalyFlag> anomalies,
                                Map<String, Dataset> timeseries,
                                Instant timestamp) {

    public CalculationResult {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        auditTrail = List.copyOf(auditTrail);
        anomalies = List.copyOf(anomalies);
        timeseries = Collections.unmodifiableMap(new LinkedHashMap<>(timeseries));
    }

    /** Name to value for every KPI that produced one. */
    public Map<String, Double> values() {
        Map<String, Double> out = new LinkedHashMap<>();
        metrics.forEach((name, m) -> {
            if (m.succeeded()) out.put(name, m.value());
        });
        return out;
    }

    public List<MetricResult> failures() {
        return metrics.values().stream().filter(m -> !m.succeeded()).toList();
    }
}
