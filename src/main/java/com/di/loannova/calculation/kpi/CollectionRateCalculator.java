package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cash available over total eligible receivables, rounded to two places. Cash above the eligible
 * balance is reported as 100 and flagged {@code clamped}.
 */
@Component
public class CollectionRateCalculator extends AbstractKpiCalculator {

    @Override
    public String name() {
        return KpiCatalog.COLLECTION_RATE;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        long nulls = nullCount(ds, "cash_available_usd", "total_eligible_usd");
        double cash = ds.sum("cash_available_usd");
        double eligible = ds.sum("total_eligible_usd");
        if (eligible == 0.0) {
            return value(0.0, ds, nulls, now, Map.of("reason", "Zero total eligible"));
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("cash_sum", cash);
        extra.put("eligible_sum", eligible);
        double rate = boundedPercent(cash / eligible * 100.0, extra);
        return value(BigDecimal.valueOf(rate).setScale(2, RoundingMode.HALF_UP).doubleValue(), ds, nulls, now, extra);
    }
}
