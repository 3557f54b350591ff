package com.di.loannova.calculation;

import com.di.loannova.common.Dataset;
import com.di.loannova.exception.CalculationException;

import java.time.Instant;

/**
 * One dataset-level KPI. Implementations are Spring components and are picked up by
 * {@link CalculationService} in catalogue order.
 */
public interface KpiCalculator {

    /** Catalogue name, see {@link KpiCatalog}. */
    String name();

    default KpiDefinition definition() {
        return KpiCatalog.get(name());
    }

    /**
     * @throws CalculationException when the dataset lacks the columns this KPI needs
     */
    KpiValue calculate(Dataset dataset, Instant now);
}
