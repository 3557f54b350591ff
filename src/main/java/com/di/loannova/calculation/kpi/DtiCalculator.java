package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/** Mean monthly debt over monthly income, for borrowers with positive income. */
@Component
public class DtiCalculator extends AbstractKpiCalculator {

    @Override
    public String name() {
        return KpiCatalog.DTI;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        requireColumns(ds, "monthly_debt", "borrower_income");
        RatioMean mean = RatioMean.over(ds, "monthly_debt", "borrower_income", 1.0 / 12.0);
        return value(mean.value(), ds, nullCount(ds, "monthly_debt", "borrower_income"), now, Map.of(
                "avg_monthly_debt", mean.avgNumerator(),
                "avg_monthly_income", mean.avgDenominator(),
                "rows_with_ratio", mean.count()));
    }
}
