package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Portfolio at risk beyond 90 days. Absent columns count as zero balances. */
@Component
public class Par90Calculator extends AbstractKpiCalculator {

    @Override
    public String name() {
        return KpiCatalog.PAR90;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        long nulls = nullCount(ds, "dpd_90_plus_usd");
        double dpd = ds.sum("dpd_90_plus_usd");
        double total = ds.sum("total_receivable_usd");
        if (total == 0.0) {
            return value(0.0, ds, nulls, now, Map.of("reason", "Zero total receivable"));
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("dpd_sum", dpd);
        extra.put("total_receivable_sum", total);
        return value(boundedPercent(dpd / total * 100.0, extra), ds, nulls, now, extra);
    }
}
