package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/** Mean loan-to-value over loans with a positive appraisal. */
@Component
public class LtvCalculator extends AbstractKpiCalculator {

    @Override
    public String name() {
        return KpiCatalog.LTV;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        requireColumns(ds, "loan_amount", "appraised_value");
        RatioMean mean = RatioMean.over(ds, "loan_amount", "appraised_value", 1.0);
        return value(mean.value(), ds, nullCount(ds, "loan_amount", "appraised_value"), now, Map.of(
                "avg_loan_amount", mean.avgNumerator(),
                "avg_appraised_value", mean.avgDenominator(),
                "rows_with_ratio", mean.count()));
    }
}
