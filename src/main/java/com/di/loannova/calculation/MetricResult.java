package com.di.loannova.calculation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Published form of a KPI evaluation, as it appears under {@code metrics} in the manifest.
 * A failed KPI has a {@code null} value and an {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricResult(String name,
                           String displayName,
                           Double value,
                           String unit,
                           String formula,
                           KpiStatus status,
                           Double thresholdWarning,
                           Double thresholdCritical,
                           String error,
                           Map<String, Object> context) {

    public static MetricResult success(KpiDefinition def, KpiValue value) {
        return new MetricResult(def.name(), def.displayName(), value.value(), def.unit(), def.formula(),
                KpiCatalog.status(def, value.value()), def.warning(), def.critical(), null, value.context());
    }

    public static MetricResult failure(KpiDefinition def, String error) {
        return new MetricResult(def.name(), def.displayName(), null, def.unit(), def.formula(),
                KpiStatus.UNKNOWN, def.warning(), def.critical(), error, Map.of());
    }

    public boolean succeeded() {
        return value != null;
    }
}
