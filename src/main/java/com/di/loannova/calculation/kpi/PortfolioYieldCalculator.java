package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/** Balance-weighted average interest rate. */
@Component
public class PortfolioYieldCalculator extends AbstractKpiCalculator {

    @Override
    public String name() {
        return KpiCatalog.PORTFOLIO_YIELD;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        requireColumns(ds, "interest_rate", "principal_balance");
        long nulls = nullCount(ds, "interest_rate", "principal_balance");
        double principal = 0.0;
        double weighted = 0.0;
        for (Map<String, Object> row : ds.rows()) {
            double balance = num(row, "principal_balance");
            principal += balance;
            weighted += num(row, "interest_rate") * balance;
        }
        if (principal == 0.0) {
            return value(0.0, ds, nulls, now, Map.of("reason", "Zero total principal"));
        }
        return value(weighted / principal * 100.0, ds, nulls, now,
                Map.of("total_principal", principal, "weighted_interest", weighted));
    }
}
