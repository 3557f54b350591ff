package com.di.loannova.calculation;

/**
 * Catalogue entry for one KPI: what it measures, who owns it and where its alert levels sit.
 *
 * @param warning  warning level, {@code null} when the KPI is informational
 * @param critical critical level, {@code null} when the KPI is informational
 */
public record KpiDefinition(String name,
                            String displayName,
                            String description,
                            String formula,
                            String unit,
                            String owner,
                            Double warning,
                            Double critical,
                            Direction direction,
                            boolean composite) {

    /** Which way a value has to move to cross a threshold. */
    public enum Direction {
        HIGHER_IS_WORSE,
        LOWER_IS_WORSE
    }

    public KpiDefinition withThresholds(Double warning, Double critical) {
        return new KpiDefinition(name, displayName, description, formula, unit, owner,
                warning, critical, direction, composite);
    }
}
